package org.dxworks.sqlportability.analyzer.template;

/**
 * A lexed piece of template source. {@code value} is the raw text of the token,
 * whitespace and quotes included.
 */
public final class TemplateToken {
    public final TemplateTokenType type;
    public final String value;
    public final int offset;

    public TemplateToken(TemplateTokenType type, String value, int offset) {
        this.type = type;
        this.value = value;
        this.offset = offset;
    }

    @Override
    public String toString() {
        return type + "(" + value + ")@" + offset;
    }
}
