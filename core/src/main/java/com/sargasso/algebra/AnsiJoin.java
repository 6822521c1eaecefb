package com.sargasso.algebra;

import com.sargasso.expression.Expression;
import java.util.Objects;

/**
 * ANSI join or nest of a FROM term with a simple right-hand term.
 *
 * <p>A JOIN produces one output row per matching pair. A NEST produces one row
 * per left row, with the matching right documents gathered into an array.
 * Either may be outer (LEFT), keeping left rows without matches.
 *
 * <p>The outer flag is the only mutable part of the FROM tree: the planner
 * clears it when it proves the join can be evaluated as an inner join.
 */
public final class AnsiJoin implements FromTerm {

    /**
     * Kind of ANSI join.
     */
    public enum Kind {
        JOIN,
        NEST
    }

    private final FromTerm left;
    private final SimpleTerm right;
    private final Expression onclause;
    private final Kind kind;
    private boolean outer;

    /**
     * Creates an ANSI join.
     *
     * @param left the left input
     * @param right the right-hand term
     * @param onclause the ON clause
     * @param kind JOIN or NEST
     * @param outer whether this is a LEFT OUTER join or nest
     */
    public AnsiJoin(FromTerm left, SimpleTerm right, Expression onclause, Kind kind, boolean outer) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
        this.onclause = Objects.requireNonNull(onclause, "onclause must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.outer = outer;
    }

    // ==================== Factory Methods ====================

    public static AnsiJoin join(FromTerm left, SimpleTerm right, Expression onclause) {
        return new AnsiJoin(left, right, onclause, Kind.JOIN, false);
    }

    public static AnsiJoin leftJoin(FromTerm left, SimpleTerm right, Expression onclause) {
        return new AnsiJoin(left, right, onclause, Kind.JOIN, true);
    }

    public static AnsiJoin nest(FromTerm left, SimpleTerm right, Expression onclause) {
        return new AnsiJoin(left, right, onclause, Kind.NEST, false);
    }

    public static AnsiJoin leftNest(FromTerm left, SimpleTerm right, Expression onclause) {
        return new AnsiJoin(left, right, onclause, Kind.NEST, true);
    }

    public FromTerm left() {
        return left;
    }

    public SimpleTerm right() {
        return right;
    }

    public Expression onclause() {
        return onclause;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNest() {
        return kind == Kind.NEST;
    }

    public boolean isOuter() {
        return outer;
    }

    /**
     * Marks this join as outer or inner.
     *
     * @param outer the new outer flag
     */
    public void setOuter(boolean outer) {
        this.outer = outer;
    }

    @Override
    public String alias() {
        return right.alias();
    }

    @Override
    public SimpleTerm primaryTerm() {
        return left.primaryTerm();
    }

    @Override
    public String toString() {
        return left + (outer ? " LEFT " : " ") + kind + " " + right + " ON " + onclause.toSQL();
    }
}
