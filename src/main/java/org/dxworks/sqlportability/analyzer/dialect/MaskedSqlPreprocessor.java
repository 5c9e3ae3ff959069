package org.dxworks.sqlportability.analyzer.dialect;

import java.util.regex.Pattern;

/**
 * Preprocesses masked SQL so that JSqlParser accepts it.
 * Handles leftovers of template masking that are not valid SQL on their own:
 * - Removes placeholders standing in front of the first statement keyword
 *   (a leading {@code {{ config(...) }}} or {@code {# comment #}}), together
 *   with the SQL comments between them
 * - Removes dangling commas that comma-terminated placeholders leave before a
 *   clause keyword, a closing parenthesis or the end of the text
 */
public final class MaskedSqlPreprocessor {

    private static final Pattern LEADING_PLACEHOLDERS = Pattern.compile(
            "^(?:\\s|--[^\\n]*+|/\\*[\\s\\S]*?\\*/|__JINJA__\\s*+,|__PLACEHOLDER__)++"
                    + "(?=(?:select|with|insert|update|delete|merge|values)\\b|\\()",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DANGLING_COMMA = Pattern.compile(
            ",(\\s*)(?=(?:from|where|group|order|having|limit|qualify|window|union|intersect|except)\\b|\\)|;|$)",
            Pattern.CASE_INSENSITIVE);

    private MaskedSqlPreprocessor() {
        // utility class
    }

    public static String preprocess(String maskedSql) {
        if (maskedSql == null) return null;
        String sql = LEADING_PLACEHOLDERS.matcher(maskedSql).replaceFirst("");
        return DANGLING_COMMA.matcher(sql).replaceAll("$1");
    }
}
