package com.sargasso.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Searched CASE expression.
 */
public final class CaseWhen implements Expression {

    /**
     * One {@code WHEN condition THEN result} arm.
     */
    public record WhenClause(Expression condition, Expression result) {
        public WhenClause {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(result, "result must not be null");
        }
    }

    private final List<WhenClause> whenClauses;
    private final Expression elseExpr;

    /**
     * Creates a CASE expression.
     *
     * @param whenClauses the arms, at least one
     * @param elseExpr the ELSE result (may be null, meaning NULL)
     */
    public CaseWhen(List<WhenClause> whenClauses, Expression elseExpr) {
        Objects.requireNonNull(whenClauses, "whenClauses must not be null");
        if (whenClauses.isEmpty()) {
            throw new IllegalArgumentException("CASE requires at least one WHEN clause");
        }
        this.whenClauses = List.copyOf(whenClauses);
        this.elseExpr = elseExpr;
    }

    public List<WhenClause> whenClauses() {
        return whenClauses;
    }

    /**
     * Returns the ELSE result.
     *
     * @return the else expression, or null if absent
     */
    public Expression elseExpr() {
        return elseExpr;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCaseWhen(this);
    }

    @Override
    public List<Expression> children() {
        List<Expression> children = new ArrayList<>();
        for (WhenClause clause : whenClauses) {
            children.add(clause.condition());
            children.add(clause.result());
        }
        if (elseExpr != null) {
            children.add(elseExpr);
        }
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toSQL() {
        StringBuilder sb = new StringBuilder("CASE");
        for (WhenClause clause : whenClauses) {
            sb.append(" WHEN ").append(clause.condition().toSQL())
              .append(" THEN ").append(clause.result().toSQL());
        }
        if (elseExpr != null) {
            sb.append(" ELSE ").append(elseExpr.toSQL());
        }
        return sb.append(" END").toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CaseWhen)) return false;
        CaseWhen other = (CaseWhen) obj;
        return whenClauses.equals(other.whenClauses) && Objects.equals(elseExpr, other.elseExpr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(whenClauses, elseExpr);
    }
}
