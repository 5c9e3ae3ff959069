package org.dxworks.sqlportability.analyzer.rewrite;

import org.dxworks.sqlportability.model.rewrite.RewriteDirective;
import org.dxworks.sqlportability.model.template.MaskedSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies rewrite directives to the original text of a span.
 * <p>
 * Directives run longest original text first so a short call never matches
 * inside a longer one. Each directive replaces one occurrence: the first exact
 * match that is not inside an open {@code {{ ... }}}, or failing that the first
 * such case-insensitive match.
 */
public final class SpanRewriter {

    private static final String EXPRESSION_OPEN = "{{";
    private static final String EXPRESSION_CLOSE = "}}";

    private SpanRewriter() {
        // utility class
    }

    public static RewriteState rewriteSpan(RewriteState state, MaskedSpan span, List<RewriteDirective> directives) {
        if (directives.isEmpty()) {
            return state;
        }
        String original = state.sliceOf(span);
        return state.splice(span, applyDirectives(original, directives));
    }

    public static String applyDirectives(String spanText, List<RewriteDirective> directives) {
        List<RewriteDirective> ordered = new ArrayList<>(directives);
        ordered.sort(Comparator.comparingInt((RewriteDirective d) -> d.originalText.length()).reversed());

        String text = spanText;
        for (RewriteDirective directive : ordered) {
            int at = locate(text, directive.originalText);
            if (at < 0) {
                continue;
            }
            text = text.substring(0, at)
                    + directive.replacementText
                    + text.substring(at + directive.originalText.length());
        }
        return text;
    }

    /**
     * @return index of the first eligible occurrence of {@code pattern}, or -1
     */
    static int locate(String text, String pattern) {
        if (pattern.isEmpty()) {
            return -1;
        }
        for (int at = text.indexOf(pattern); at >= 0; at = text.indexOf(pattern, at + 1)) {
            if (!insideOpenExpression(text, at)) {
                return at;
            }
        }
        for (int at = 0; at + pattern.length() <= text.length(); at++) {
            if (text.regionMatches(true, at, pattern, 0, pattern.length()) && !insideOpenExpression(text, at)) {
                return at;
            }
        }
        return -1;
    }

    /**
     * Approximate check by brace counting: true when the text before
     * {@code position} opens more expressions than it closes.
     */
    static boolean insideOpenExpression(String text, int position) {
        String before = text.substring(0, position);
        return count(before, EXPRESSION_OPEN) - count(before, EXPRESSION_CLOSE) > 0;
    }

    private static int count(String text, String token) {
        int n = 0;
        for (int at = text.indexOf(token); at >= 0; at = text.indexOf(token, at + token.length())) {
            n++;
        }
        return n;
    }
}
