package org.dxworks.sqlportability.analyzer.dialect;

public class UnknownDialectException extends IllegalArgumentException {

    private final String dialect;

    public UnknownDialectException(String dialect) {
        super("Unknown dialect: " + dialect);
        this.dialect = dialect;
    }

    public String getDialect() {
        return dialect;
    }
}
