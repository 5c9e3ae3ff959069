package org.dxworks.sqlportability.analyzer.dialect;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link DialectProfile} that parses with JSqlParser and renders function calls
 * from the dialect's {@link FunctionCatalog}.
 */
public class CatalogDialectProfile implements DialectProfile {

    private static final Pattern TEMPLATE_SLOT = Pattern.compile("\\{(\\d+|args)}");

    private final String name;
    private final FunctionCatalog catalog;

    public CatalogDialectProfile(String name, FunctionCatalog catalog) {
        this.name = name;
        this.catalog = catalog;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public FunctionCatalog catalog() {
        return catalog;
    }

    @Override
    public List<Statement> parse(String maskedSql) throws JSQLParserException {
        String sql = MaskedSqlPreprocessor.preprocess(maskedSql);
        Statements statements = CCJSqlParserUtil.parseStatements(
                sql,
                p -> p.withAllowComplexParsing(true)
        );

        List<Statement> out = new ArrayList<>();
        if (statements != null && statements.getStatements() != null) {
            for (Statement st : statements.getStatements()) {
                if (st != null) out.add(st);
            }
        }
        return out;
    }

    @Override
    public String render(FunctionCall call) throws UnsupportedFunctionException {
        Function fn = call.getNode();
        List<String> args = renderArguments(call);
        String implementation = call.implementation().orElse(null);

        if (implementation == null) {
            // unknown to the reading dialect, written the same way everywhere
            return fn.getName() + callTail(fn, args);
        }
        if (catalog.isUnsupported(implementation)) {
            throw new UnsupportedFunctionException(implementation + " is not supported by " + name);
        }

        String rendering = catalog.renderingOf(implementation);
        if (!TEMPLATE_SLOT.matcher(rendering).find()) {
            return rendering + callTail(fn, args);
        }
        if (name.equals(call.getReadDialect().getName())) {
            // templates may reorder arguments; a call this dialect read is already in its form
            return fn.getName() + callTail(fn, args);
        }
        if (!isPlainCall(fn)) {
            throw new UnsupportedFunctionException(
                    "Cannot apply " + name + " template for " + implementation + " to " + fn);
        }
        return applyTemplate(rendering, args, fn.isDistinct());
    }

    private List<String> renderArguments(FunctionCall call) throws UnsupportedFunctionException {
        Function fn = call.getNode();
        List<String> args = new ArrayList<>();
        if (fn.getParameters() != null) {
            for (Expression param : fn.getParameters()) {
                if (param instanceof Function) {
                    args.add(render(call.nested((Function) param)));
                } else {
                    args.add(String.valueOf(param));
                }
            }
        }
        return args;
    }

    /**
     * Parenthesized part of the call. Calls carrying more than a plain argument
     * list (named arguments, ORDER BY, KEEP, ...) keep JSqlParser's own text.
     */
    private static String callTail(Function fn, List<String> args) {
        if (!isPlainCall(fn)) {
            String text = fn.toString();
            return text.substring(fn.getName().length());
        }
        return "(" + (fn.isDistinct() ? "DISTINCT " : "") + String.join(", ", args) + ")";
    }

    private static boolean isPlainCall(Function fn) {
        List<String> raw = new ArrayList<>();
        if (fn.getParameters() != null) {
            for (Expression param : fn.getParameters()) {
                raw.add(String.valueOf(param));
            }
        }
        String plain = fn.getName() + "(" + (fn.isDistinct() ? "DISTINCT " : "") + String.join(", ", raw) + ")";
        return plain.equals(fn.toString());
    }

    private String applyTemplate(String template, List<String> args, boolean distinct)
            throws UnsupportedFunctionException {
        List<String> slots = new ArrayList<>(args);
        if (distinct && !slots.isEmpty()) {
            slots.set(0, "DISTINCT " + slots.get(0));
        }

        Matcher m = TEMPLATE_SLOT.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String slot = m.group(1);
            String value;
            if ("args".equals(slot)) {
                value = String.join(", ", slots);
            } else {
                int index = Integer.parseInt(slot);
                if (index >= slots.size()) {
                    throw new UnsupportedFunctionException(
                            name + " template " + template + " needs " + (index + 1) + " arguments, got " + slots.size());
                }
                value = slots.get(index);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    @Override
    public String toString() {
        return name;
    }
}
