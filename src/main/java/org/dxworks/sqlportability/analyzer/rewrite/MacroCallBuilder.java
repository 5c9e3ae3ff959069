package org.dxworks.sqlportability.analyzer.rewrite;

import org.dxworks.sqlportability.analyzer.macro.MacroNaming;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the {@code {{ portable_x(...) }}} expression that replaces a call.
 * The interior of the call's parentheses becomes the macro's argument; anything
 * that is not already a single quoted literal is passed as a quoted string.
 */
public final class MacroCallBuilder {

    private static final Pattern CALL = Pattern.compile(
            "[A-Z_][A-Z0-9_]*\\s*\\((.*)\\)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern QUOTED_LITERAL = Pattern.compile(
            "'(?:[^'\\\\]|\\\\.)*'|\"(?:[^\"\\\\]|\\\\.)*\"",
            Pattern.DOTALL);

    private MacroCallBuilder() {
        // utility class
    }

    public static String build(String renderedName, String renderedText) {
        String macro = MacroNaming.portableMacroName(renderedName);

        Matcher m = CALL.matcher(renderedText.trim());
        if (!m.matches()) {
            return "{{ " + macro + "() }}";
        }

        String interior = m.group(1).trim();
        if (interior.isEmpty()) {
            return "{{ " + macro + "() }}";
        }
        if (isQuotedLiteral(interior)) {
            return "{{ " + macro + "(" + interior + ") }}";
        }
        return "{{ " + macro + "('" + escape(interior) + "') }}";
    }

    static boolean isQuotedLiteral(String text) {
        return QUOTED_LITERAL.matcher(text).matches();
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("'", "\\'");
    }
}
