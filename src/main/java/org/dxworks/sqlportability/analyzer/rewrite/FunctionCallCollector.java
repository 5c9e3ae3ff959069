package org.dxworks.sqlportability.analyzer.rewrite;

import net.sf.jsqlparser.expression.AnalyticExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.operators.relational.ExistsExpression;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.Values;
import net.sf.jsqlparser.statement.select.WithItem;
import net.sf.jsqlparser.statement.update.Update;
import net.sf.jsqlparser.statement.update.UpdateSet;
import org.dxworks.sqlportability.analyzer.dialect.DialectProfile;
import org.dxworks.sqlportability.analyzer.dialect.FunctionCall;
import org.dxworks.sqlportability.analyzer.dialect.UnsupportedFunctionException;
import org.dxworks.sqlportability.model.rewrite.FunctionCandidate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Depth-first walk over parsed statements collecting every function call,
 * outer calls before the calls nested in their arguments.
 */
public final class FunctionCallCollector {

    private final DialectProfile primary;
    private final List<FunctionCandidate> candidates = new ArrayList<>();
    private final FunctionVisitor visitor = new FunctionVisitor();
    private int depth;

    private FunctionCallCollector(DialectProfile primary) {
        this.primary = primary;
    }

    public static List<FunctionCandidate> collect(List<Statement> statements, DialectProfile primary) {
        FunctionCallCollector collector = new FunctionCallCollector(primary);
        for (Statement st : statements) {
            collector.visitStatement(st);
        }
        return collector.candidates;
    }

    /**
     * Name in front of the first parenthesis of a rendered call, upper-cased.
     */
    static String renderedNameOf(String renderedText, String fallback) {
        int paren = renderedText.indexOf('(');
        String name = paren > 0 ? renderedText.substring(0, paren).trim() : fallback;
        return name.toUpperCase(Locale.ROOT);
    }

    private void visitStatement(Statement st) {
        if (st instanceof Select) {
            visitSelect((Select) st);
        } else if (st instanceof Insert) {
            Insert ins = (Insert) st;
            if (ins.getSelect() != null) {
                visitSelect(ins.getSelect());
            }
        } else if (st instanceof Update) {
            visitUpdate((Update) st);
        } else if (st instanceof Delete) {
            visitExpression(((Delete) st).getWhere());
        }
    }

    private void visitSelect(Select select) {
        if (select == null) return;
        depth++;

        if (select.getWithItemsList() != null) {
            for (WithItem wi : select.getWithItemsList()) {
                if (wi.getSelect() != null) {
                    visitSelect(wi.getSelect());
                }
            }
        }

        if (select instanceof PlainSelect) {
            visitPlainSelect((PlainSelect) select);
        } else if (select instanceof ParenthesedSelect) {
            visitSelect(((ParenthesedSelect) select).getSelect());
        } else if (select instanceof SetOperationList) {
            for (Select s : ((SetOperationList) select).getSelects()) {
                visitSelect(s);
            }
        } else if (select instanceof Values) {
            Values values = (Values) select;
            if (values.getExpressions() != null) {
                for (Object e : values.getExpressions()) {
                    if (e instanceof Expression) {
                        visitExpression((Expression) e);
                    }
                }
            }
        }

        depth--;
    }

    private void visitPlainSelect(PlainSelect ps) {
        if (ps.getSelectItems() != null) {
            for (SelectItem<?> si : ps.getSelectItems()) {
                visitExpression(si.getExpression());
            }
        }

        visitFromItem(ps.getFromItem());
        if (ps.getJoins() != null) {
            for (Join j : ps.getJoins()) {
                visitFromItem(j.getRightItem());
                if (j.getOnExpressions() != null) {
                    for (Expression e : j.getOnExpressions()) {
                        visitExpression(e);
                    }
                }
            }
        }

        visitExpression(ps.getWhere());

        if (ps.getGroupBy() != null && ps.getGroupBy().getGroupByExpressionList() != null) {
            for (Object e : ps.getGroupBy().getGroupByExpressionList()) {
                if (e instanceof Expression) {
                    visitExpression((Expression) e);
                }
            }
        }

        visitExpression(ps.getHaving());

        if (ps.getOrderByElements() != null) {
            for (OrderByElement o : ps.getOrderByElements()) {
                visitExpression(o.getExpression());
            }
        }
    }

    private void visitFromItem(FromItem item) {
        if (item instanceof ParenthesedSelect) {
            visitSelect(((ParenthesedSelect) item).getSelect());
        }
    }

    private void visitUpdate(Update update) {
        if (update.getUpdateSets() != null) {
            for (UpdateSet us : update.getUpdateSets()) {
                if (us.getValues() != null) {
                    for (Expression e : us.getValues()) {
                        visitExpression(e);
                    }
                }
            }
        }
        visitExpression(update.getWhere());
    }

    private void visitExpression(Expression expr) {
        if (expr == null) return;
        expr.accept(visitor, null);
    }

    private void record(Function function) {
        FunctionCall call = new FunctionCall(function, primary);
        String rendered;
        try {
            rendered = primary.render(call);
        } catch (UnsupportedFunctionException | RuntimeException e) {
            rendered = function.toString();
        }
        candidates.add(new FunctionCandidate(depth, renderedNameOf(rendered, function.getName()), rendered, call));
    }

    private static Function callOf(AnalyticExpression analytic) {
        List<Expression> params = new ArrayList<>();
        if (analytic.isAllColumns()) {
            params.add(new AllColumns());
        }
        for (Expression e : new Expression[]{
                analytic.getExpression(), analytic.getOffset(), analytic.getDefaultValue()}) {
            if (e != null) params.add(e);
        }

        Function call = new Function();
        call.setName(analytic.getName());
        call.setDistinct(analytic.isDistinct());
        if (!params.isEmpty()) {
            call.setParameters(new ExpressionList<>(params));
        }
        return call;
    }

    private class FunctionVisitor extends ExpressionVisitorAdapter<Void> {

        @Override
        public <S> Void visit(Function function, S context) {
            if (function == null) return null;
            record(function);
            depth++;
            if (function.getParameters() != null) {
                for (Expression param : function.getParameters()) {
                    if (param != null) {
                        param.accept(this, context);
                    }
                }
            }
            depth--;
            return null;
        }

        /**
         * A windowed call. Only the call in front of {@code OVER} is recorded, so
         * its rendering matches the source text the window clause follows.
         */
        @Override
        public <S> Void visit(AnalyticExpression analytic, S context) {
            if (analytic == null) return null;
            Function call = callOf(analytic);
            record(call);
            depth++;
            if (call.getParameters() != null) {
                for (Expression param : call.getParameters()) {
                    if (param != null) {
                        param.accept(this, context);
                    }
                }
            }
            if (analytic.getPartitionExpressionList() != null) {
                for (Expression e : analytic.getPartitionExpressionList()) {
                    if (e != null) {
                        e.accept(this, context);
                    }
                }
            }
            if (analytic.getOrderByElements() != null) {
                for (OrderByElement o : analytic.getOrderByElements()) {
                    if (o.getExpression() != null) {
                        o.getExpression().accept(this, context);
                    }
                }
            }
            depth--;
            return null;
        }

        @Override
        public <S> Void visit(ParenthesedSelect subquery, S context) {
            if (subquery == null) return null;
            visitSelect(subquery.getSelect());
            return null;
        }

        @Override
        public <S> Void visit(ExistsExpression exists, S context) {
            if (exists == null) return null;
            Expression right = exists.getRightExpression();
            if (right instanceof ParenthesedSelect) {
                visitSelect(((ParenthesedSelect) right).getSelect());
            } else if (right != null) {
                right.accept(this, context);
            }
            return null;
        }
    }
}
