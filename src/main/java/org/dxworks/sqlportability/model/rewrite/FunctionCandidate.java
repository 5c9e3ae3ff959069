package org.dxworks.sqlportability.model.rewrite;

import org.dxworks.sqlportability.analyzer.dialect.FunctionCall;

/**
 * A function call found in masked SQL. {@code renderedText} is the call written
 * by the primary dialect and {@code renderedName} the upper-cased name in front of
 * its parenthesis.
 */
public final class FunctionCandidate {
    public final int depth;
    public final String renderedName;
    public final String renderedText;
    public final FunctionCall call;

    public FunctionCandidate(int depth, String renderedName, String renderedText, FunctionCall call) {
        this.depth = depth;
        this.renderedName = renderedName;
        this.renderedText = renderedText;
        this.call = call;
    }

    @Override
    public String toString() {
        return renderedName + "@" + depth;
    }
}
