package com.sargasso.algebra;

import com.sargasso.expression.Expression;
import java.util.Objects;

/**
 * An expression iterated as a FROM term ({@code FROM [1, 2, 3] AS v}).
 *
 * <p>The term is correlated when its expression refers to aliases of earlier
 * FROM terms; a correlated term must be evaluated once per left-hand row.
 */
public final class ExpressionTerm implements SimpleTerm {

    private final Expression expression;
    private final String alias;
    private final JoinHint joinHint;

    public ExpressionTerm(Expression expression, String alias, JoinHint joinHint) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        this.joinHint = Objects.requireNonNull(joinHint, "joinHint must not be null");
    }

    public ExpressionTerm(Expression expression, String alias) {
        this(expression, alias, JoinHint.NONE);
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public String alias() {
        return alias;
    }

    @Override
    public JoinHint joinHint() {
        return joinHint;
    }

    @Override
    public String toString() {
        return expression.toSQL() + " AS " + alias;
    }
}
