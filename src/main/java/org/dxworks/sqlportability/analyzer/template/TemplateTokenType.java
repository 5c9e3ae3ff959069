package org.dxworks.sqlportability.analyzer.template;

public enum TemplateTokenType {
    DATA,
    VARIABLE_BEGIN,
    VARIABLE_END,
    BLOCK_BEGIN,
    BLOCK_END,
    COMMENT_BEGIN,
    COMMENT,
    COMMENT_END,
    NAME,
    STRING,
    NUMBER,
    OPERATOR,
    WHITESPACE;

    public boolean isUnitOpener() {
        return this == VARIABLE_BEGIN || this == BLOCK_BEGIN || this == COMMENT_BEGIN;
    }

    public boolean isUnitCloser() {
        return this == VARIABLE_END || this == BLOCK_END || this == COMMENT_END;
    }
}
