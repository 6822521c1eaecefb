package com.sargasso.algebra;

import com.sargasso.expression.Subquery;
import java.util.Objects;

/**
 * A subquery used as a FROM term ({@code FROM (SELECT ...) AS s}).
 */
public final class SubqueryTerm implements SimpleTerm {

    private final Subquery subquery;
    private final String alias;
    private final JoinHint joinHint;

    public SubqueryTerm(Subquery subquery, String alias, JoinHint joinHint) {
        this.subquery = Objects.requireNonNull(subquery, "subquery must not be null");
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        this.joinHint = Objects.requireNonNull(joinHint, "joinHint must not be null");
    }

    public SubqueryTerm(Subquery subquery, String alias) {
        this(subquery, alias, JoinHint.NONE);
    }

    public Subquery subquery() {
        return subquery;
    }

    public boolean isCorrelated() {
        return subquery.isCorrelated();
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
        return subquery.toSQL() + " AS " + alias;
    }
}
