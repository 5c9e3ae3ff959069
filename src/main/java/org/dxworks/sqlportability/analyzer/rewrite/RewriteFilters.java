package org.dxworks.sqlportability.analyzer.rewrite;

import net.sf.jsqlparser.expression.Function;
import org.dxworks.sqlportability.analyzer.dialect.DialectOracle;
import org.dxworks.sqlportability.model.rewrite.FunctionCandidate;

import java.util.List;
import java.util.Set;

/**
 * The two checks a function call has to pass before it is replaced by a
 * portable macro call.
 */
public final class RewriteFilters {

    // spelled the same in every dialect; a bare call is never worth a macro
    static final Set<String> UNIFORM_AGGREGATES = Set.of("COUNT", "SUM", "MIN", "MAX", "AVG");

    private RewriteFilters() {
        // utility class
    }

    public static boolean isMeaningfullyRewritable(FunctionCandidate candidate) {
        if (candidate.renderedText.contains("*")) {
            return false;
        }
        return !(hasNoArguments(candidate.call.getNode())
                && UNIFORM_AGGREGATES.contains(candidate.renderedName));
    }

    public static boolean differsAcrossDialects(FunctionCandidate candidate, List<String> dialects) {
        return DialectOracle.functionDiffersAcross(candidate.call, dialects);
    }

    private static boolean hasNoArguments(Function fn) {
        return fn.getParameters() == null || fn.getParameters().isEmpty();
    }
}
