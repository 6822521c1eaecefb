package com.sargasso.planner.sarg;

import com.sargasso.expression.Expression;
import com.sargasso.expression.Expressions;
import com.sargasso.expression.Literal;
import com.sargasso.value.Value;
import java.util.Objects;
import java.util.Optional;

/**
 * A range of values for one index key position.
 *
 * <p>Bounds are expressions so that a range can depend on a parameter or, for a
 * nested-loop join, on a value of the outer side. A null bound is unbounded.
 * Ranges that must exclude MISSING and NULL keys start just above NULL: a
 * {@code NULL} low bound that is not inclusive.
 */
public final class KeyRange {

    private static final KeyRange FULL = new KeyRange(null, null, Inclusion.NEITHER);
    private static final KeyRange VALUED = new KeyRange(Literal.NULL, null, Inclusion.NEITHER);

    private final Expression low;
    private final Expression high;
    private final Inclusion inclusion;

    public KeyRange(Expression low, Expression high, Inclusion inclusion) {
        this.low = low;
        this.high = high;
        this.inclusion = Objects.requireNonNull(inclusion, "inclusion must not be null");
    }

    // ==================== Factory Methods ====================

    /**
     * Returns the range of every key, MISSING included.
     */
    public static KeyRange full() {
        return FULL;
    }

    /**
     * Returns the range of every key that is neither MISSING nor NULL.
     */
    public static KeyRange valued() {
        return VALUED;
    }

    public static KeyRange point(Expression value) {
        return new KeyRange(value, value, Inclusion.BOTH);
    }

    public static KeyRange point(Value value) {
        return point(new Literal(value));
    }

    /**
     * Returns the range above NULL up to a bound.
     *
     * @param high the upper bound
     * @param inclusive whether the bound is inclusive
     * @return the range
     */
    public static KeyRange below(Expression high, boolean inclusive) {
        return new KeyRange(Literal.NULL, high, Inclusion.of(false, inclusive));
    }

    public static KeyRange above(Expression low, boolean inclusive) {
        return new KeyRange(low, null, Inclusion.of(inclusive, false));
    }

    public Expression low() {
        return low;
    }

    public Expression high() {
        return high;
    }

    public Inclusion inclusion() {
        return inclusion;
    }

    /**
     * Returns the value of the low bound if it is known at planning time.
     */
    public Optional<Value> lowValue() {
        return low == null ? Optional.empty() : Expressions.staticValue(low);
    }

    public Optional<Value> highValue() {
        return high == null ? Optional.empty() : Expressions.staticValue(high);
    }

    public boolean isFull() {
        return low == null && high == null;
    }

    /**
     * Returns whether both bounds are unbounded or known at planning time.
     */
    public boolean isStatic() {
        return (low == null || lowValue().isPresent()) && (high == null || highValue().isPresent());
    }

    /**
     * Returns whether this range is a single value.
     */
    public boolean isPoint() {
        return low != null && inclusion == Inclusion.BOTH && low.equals(high);
    }

    /**
     * Returns whether this range provably contains no value.
     */
    public boolean isEmpty() {
        Optional<Value> lowValue = lowValue();
        Optional<Value> highValue = highValue();
        if (lowValue.isEmpty() || highValue.isEmpty()) {
            return false;
        }
        int cmp = lowValue.get().compareTo(highValue.get());
        return cmp > 0 || (cmp == 0 && inclusion != Inclusion.BOTH);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof KeyRange)) return false;
        KeyRange other = (KeyRange) obj;
        return inclusion == other.inclusion
            && Objects.equals(low, other.low)
            && Objects.equals(high, other.high);
    }

    @Override
    public int hashCode() {
        return Objects.hash(low, high, inclusion);
    }

    @Override
    public String toString() {
        if (isPoint()) {
            return "[" + low.toSQL() + "]";
        }
        return (inclusion.includesLow() ? "[" : "(")
            + (low == null ? "-inf" : low.toSQL())
            + ", "
            + (high == null ? "+inf" : high.toSQL())
            + (inclusion.includesHigh() ? "]" : ")");
    }
}
