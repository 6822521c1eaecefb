package com.sargasso.algebra;

import com.sargasso.expression.Expression;
import java.util.Objects;

/**
 * Flattens an array of the left input into one row per element
 * ({@code a UNNEST a.items AS i}).
 */
public final class Unnest implements FromTerm {

    private final FromTerm left;
    private final Expression expression;
    private final String alias;
    private final boolean outer;

    public Unnest(FromTerm left, Expression expression, String alias, boolean outer) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        this.outer = outer;
    }

    public FromTerm left() {
        return left;
    }

    public Expression expression() {
        return expression;
    }

    public boolean isOuter() {
        return outer;
    }

    @Override
    public String alias() {
        return alias;
    }

    @Override
    public SimpleTerm primaryTerm() {
        return left.primaryTerm();
    }

    @Override
    public String toString() {
        return left + (outer ? " LEFT" : "") + " UNNEST " + expression.toSQL() + " AS " + alias;
    }
}
