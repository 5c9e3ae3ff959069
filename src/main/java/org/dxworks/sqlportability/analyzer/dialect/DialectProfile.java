package org.dxworks.sqlportability.analyzer.dialect;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.statement.Statement;

import java.util.List;

/**
 * Grammar and function catalog of one SQL dialect.
 */
public interface DialectProfile {

    String getName();

    FunctionCatalog catalog();

    /**
     * Parses masked SQL as this dialect reads it.
     */
    List<Statement> parse(String maskedSql) throws JSQLParserException;

    /**
     * Writes a function call out the way this dialect spells it.
     *
     * @throws UnsupportedFunctionException when the dialect has no way to express the call
     */
    String render(FunctionCall call) throws UnsupportedFunctionException;
}
