package org.dxworks.sqlportability.analyzer.dialect;

import net.sf.jsqlparser.expression.Function;

import java.util.Optional;

/**
 * A parsed function node together with the dialect that read it. The dialect that
 * parsed the call decides which implementation the name refers to; every other
 * dialect only decides how to write that implementation.
 */
public final class FunctionCall {

    private final Function node;
    private final DialectProfile readDialect;

    public FunctionCall(Function node, DialectProfile readDialect) {
        this.node = node;
        this.readDialect = readDialect;
    }

    public Function getNode() {
        return node;
    }

    public DialectProfile getReadDialect() {
        return readDialect;
    }

    /**
     * @return the catalog implementation key, empty for functions the reading dialect does not know
     */
    public Optional<String> implementation() {
        return readDialect.catalog().implementationOf(node.getName());
    }

    public FunctionCall nested(Function argument) {
        return new FunctionCall(argument, readDialect);
    }
}
