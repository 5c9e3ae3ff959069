package org.dxworks.sqlportability.analyzer.template;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizer for the Jinja-style templating layer of a SQL model.
 * <p>
 * Text outside of delimiters is emitted as {@link TemplateTokenType#DATA}. Inside
 * {@code {{ }}} and {@code {% %}} the lexer produces names, strings, numbers,
 * operators and whitespace, tracking bracket balance so that a closing delimiter
 * is only recognized at bracket depth zero. Comments ({@code {# #}}) are kept as a
 * single {@link TemplateTokenType#COMMENT} token. Token values are raw source
 * slices, so joining them gives back the input unchanged.
 */
public final class TemplateLexer {

    private static final String VARIABLE_OPEN = "{{";
    private static final String VARIABLE_CLOSE = "}}";
    private static final String BLOCK_OPEN = "{%";
    private static final String BLOCK_CLOSE = "%}";
    private static final String COMMENT_OPEN = "{#";
    private static final String COMMENT_CLOSE = "#}";

    private static final String OPERATOR_CHARS = "+-*/%~<>=!.:|,;?";
    private static final String OPENING_BRACKETS = "([{";
    private static final String CLOSING_BRACKETS = ")]}";

    private static final Pattern RAW_BLOCK_END = Pattern.compile("\\{%[-+]?\\s*endraw\\s*[-+]?%}");

    private final String source;
    private final List<TemplateToken> tokens = new ArrayList<>();
    private int pos;

    private TemplateLexer(String source) {
        this.source = source;
    }

    public static List<TemplateToken> tokenize(String source) throws TemplateSyntaxException {
        TemplateLexer lexer = new TemplateLexer(source == null ? "" : source);
        lexer.run();
        return lexer.tokens;
    }

    private void run() throws TemplateSyntaxException {
        while (pos < source.length()) {
            int open = nextOpener(pos);
            if (open < 0) {
                emit(TemplateTokenType.DATA, source.length());
                break;
            }
            if (open > pos) {
                emit(TemplateTokenType.DATA, open);
            }

            if (source.startsWith(COMMENT_OPEN, pos)) {
                lexComment();
            } else if (source.startsWith(VARIABLE_OPEN, pos)) {
                lexDelimited(TemplateTokenType.VARIABLE_BEGIN, TemplateTokenType.VARIABLE_END, VARIABLE_CLOSE);
            } else {
                int blockStart = tokens.size();
                lexDelimited(TemplateTokenType.BLOCK_BEGIN, TemplateTokenType.BLOCK_END, BLOCK_CLOSE);
                if ("raw".equals(firstName(blockStart))) {
                    lexRawBody();
                }
            }
        }
    }

    private int nextOpener(int from) {
        int best = -1;
        for (String opener : new String[]{VARIABLE_OPEN, BLOCK_OPEN, COMMENT_OPEN}) {
            int idx = source.indexOf(opener, from);
            if (idx >= 0 && (best < 0 || idx < best)) {
                best = idx;
            }
        }
        return best;
    }

    private void lexComment() throws TemplateSyntaxException {
        int start = pos;
        int close = source.indexOf(COMMENT_CLOSE, start + COMMENT_OPEN.length());
        if (close < 0) {
            throw new TemplateSyntaxException("Missing end of comment tag", start);
        }
        emit(TemplateTokenType.COMMENT_BEGIN, start + COMMENT_OPEN.length());
        if (close > pos) {
            emit(TemplateTokenType.COMMENT, close);
        }
        emit(TemplateTokenType.COMMENT_END, close + COMMENT_CLOSE.length());
    }

    private void lexDelimited(TemplateTokenType beginType, TemplateTokenType endType, String close)
            throws TemplateSyntaxException {
        int start = pos;
        int openEnd = pos + 2;
        if (openEnd < source.length() && isWhitespaceControl(source.charAt(openEnd))) {
            openEnd++;
        }
        emit(beginType, openEnd);

        Deque<Character> brackets = new ArrayDeque<>();
        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (brackets.isEmpty()) {
                if (source.startsWith(close, pos)) {
                    emit(endType, pos + close.length());
                    return;
                }
                if (isWhitespaceControl(c) && source.startsWith(close, pos + 1)) {
                    emit(endType, pos + 1 + close.length());
                    return;
                }
            }

            if (Character.isWhitespace(c)) {
                int end = pos;
                while (end < source.length() && Character.isWhitespace(source.charAt(end))) end++;
                emit(TemplateTokenType.WHITESPACE, end);
            } else if (Character.isLetter(c) || c == '_') {
                int end = pos;
                while (end < source.length()
                        && (Character.isLetterOrDigit(source.charAt(end)) || source.charAt(end) == '_')) end++;
                emit(TemplateTokenType.NAME, end);
            } else if (Character.isDigit(c)) {
                int end = pos;
                while (end < source.length()
                        && (Character.isDigit(source.charAt(end)) || source.charAt(end) == '_'
                            || source.charAt(end) == '.')) end++;
                emit(TemplateTokenType.NUMBER, end);
            } else if (c == '\'' || c == '"') {
                emit(TemplateTokenType.STRING, endOfString(c));
            } else if (OPENING_BRACKETS.indexOf(c) >= 0) {
                brackets.push(c);
                emit(TemplateTokenType.OPERATOR, pos + 1);
            } else if (CLOSING_BRACKETS.indexOf(c) >= 0) {
                if (brackets.isEmpty()) {
                    throw new TemplateSyntaxException("Unexpected '" + c + "'", pos);
                }
                char expected = CLOSING_BRACKETS.charAt(OPENING_BRACKETS.indexOf(brackets.peek()));
                if (c != expected) {
                    throw new TemplateSyntaxException("Unexpected '" + c + "', expected '" + expected + "'", pos);
                }
                brackets.pop();
                emit(TemplateTokenType.OPERATOR, pos + 1);
            } else if (OPERATOR_CHARS.indexOf(c) >= 0) {
                emit(TemplateTokenType.OPERATOR, pos + 1);
            } else {
                throw new TemplateSyntaxException("Unexpected char '" + c + "'", pos);
            }
        }

        throw new TemplateSyntaxException("Unexpected end of template, tag opened here was never closed", start);
    }

    private int endOfString(char quote) throws TemplateSyntaxException {
        int i = pos + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            i++;
        }
        throw new TemplateSyntaxException("Unterminated string", pos);
    }

    private void lexRawBody() throws TemplateSyntaxException {
        Matcher end = RAW_BLOCK_END.matcher(source);
        if (!end.find(pos)) {
            throw new TemplateSyntaxException("Missing end of raw directive", pos);
        }
        if (end.start() > pos) {
            emit(TemplateTokenType.DATA, end.start());
        }
    }

    private String firstName(int fromToken) {
        for (int i = fromToken; i < tokens.size(); i++) {
            if (tokens.get(i).type == TemplateTokenType.NAME) {
                return tokens.get(i).value;
            }
        }
        return null;
    }

    private static boolean isWhitespaceControl(char c) {
        return c == '-' || c == '+';
    }

    private void emit(TemplateTokenType type, int end) {
        tokens.add(new TemplateToken(type, source.substring(pos, end), pos));
        pos = end;
    }
}
