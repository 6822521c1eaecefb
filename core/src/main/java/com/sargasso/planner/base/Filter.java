package com.sargasso.planner.base;

import com.sargasso.cost.Cost;
import com.sargasso.expression.Expression;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One classified predicate fragment.
 *
 * <p>A filter keeps the normalized expression used for index matching and the
 * expression as written, plus the aliases it still refers to. The alias set
 * shrinks as FROM terms are planned: once every other alias is available, a
 * join filter becomes an ordinary filter of its last unplanned keyspace.
 */
public final class Filter {

    /**
     * Filter flags. IN_INDEX_SPAN, IN_HASH_JOIN and PRIMARY_JOIN are transient:
     * they describe how the current planning attempt uses the filter.
     */
    public enum Flag {
        ONCLAUSE,
        JOIN,
        DERIVED,
        UNNEST,
        SELEC_DONE,
        HAS_SUBQUERY,
        IN_INDEX_SPAN,
        IN_HASH_JOIN,
        PRIMARY_JOIN;

        public boolean isTransient() {
            return this == IN_INDEX_SPAN || this == IN_HASH_JOIN || this == PRIMARY_JOIN;
        }
    }

    private static final Set<Flag> TRANSIENT_FLAGS =
        Collections.unmodifiableSet(EnumSet.of(Flag.IN_INDEX_SPAN, Flag.IN_HASH_JOIN, Flag.PRIMARY_JOIN));

    private final Expression fltrExpr;
    private final Expression origExpr;
    private final Set<String> keyspaces;
    private final Set<String> origKeyspaces;
    private final EnumSet<Flag> flags;
    private double selectivity = Cost.SELEC_NOT_AVAILABLE;

    /**
     * Creates a filter.
     *
     * @param fltrExpr the normalized expression
     * @param origExpr the expression as written
     * @param keyspaces the aliases the filter refers to
     * @param onclause whether the filter comes from an ON clause
     * @param join whether the filter refers to more than one keyspace
     */
    public Filter(Expression fltrExpr, Expression origExpr, Set<String> keyspaces,
                  boolean onclause, boolean join) {
        this.fltrExpr = Objects.requireNonNull(fltrExpr, "fltrExpr must not be null");
        this.origExpr = Objects.requireNonNull(origExpr, "origExpr must not be null");
        this.keyspaces = new LinkedHashSet<>(Objects.requireNonNull(keyspaces, "keyspaces must not be null"));
        this.origKeyspaces = Collections.unmodifiableSet(new LinkedHashSet<>(keyspaces));
        this.flags = EnumSet.noneOf(Flag.class);
        if (onclause) {
            flags.add(Flag.ONCLAUSE);
        }
        if (join) {
            flags.add(Flag.JOIN);
        }
    }

    private Filter(Filter other) {
        this.fltrExpr = other.fltrExpr;
        this.origExpr = other.origExpr;
        this.keyspaces = new LinkedHashSet<>(other.keyspaces);
        this.origKeyspaces = other.origKeyspaces;
        this.flags = EnumSet.copyOf(other.flags);
        this.selectivity = other.selectivity;
    }

    /**
     * Returns an independent copy of this filter.
     */
    public Filter copy() {
        return new Filter(this);
    }

    public Expression fltrExpr() {
        return fltrExpr;
    }

    public Expression origExpr() {
        return origExpr;
    }

    /**
     * Returns the aliases this filter still refers to.
     *
     * @return an unmodifiable view of the current alias set
     */
    public Set<String> keyspaces() {
        return Collections.unmodifiableSet(keyspaces);
    }

    /**
     * Returns the aliases the filter referred to when it was classified.
     */
    public Set<String> origKeyspaces() {
        return origKeyspaces;
    }

    void removeKeyspace(String alias) {
        keyspaces.remove(alias);
    }

    public boolean hasFlag(Flag flag) {
        return flags.contains(flag);
    }

    public void setFlag(Flag flag) {
        flags.add(flag);
    }

    public void unsetFlag(Flag flag) {
        flags.remove(flag);
    }

    /**
     * Returns the transient flags currently set.
     */
    public EnumSet<Flag> transientFlags() {
        EnumSet<Flag> result = EnumSet.noneOf(Flag.class);
        for (Flag flag : flags) {
            if (flag.isTransient()) {
                result.add(flag);
            }
        }
        return result;
    }

    public void clearTransientFlags() {
        flags.removeAll(TRANSIENT_FLAGS);
    }

    public boolean isOnclause() {
        return flags.contains(Flag.ONCLAUSE);
    }

    public boolean isJoin() {
        return flags.contains(Flag.JOIN);
    }

    public boolean isDerived() {
        return flags.contains(Flag.DERIVED);
    }

    public boolean hasSubquery() {
        return flags.contains(Flag.HAS_SUBQUERY);
    }

    /**
     * Returns whether the filter must be evaluated after a join rather than while
     * scanning the join's right-hand keyspace.
     *
     * <p>On the subservient side of an outer join only ON-clause fragments may
     * restrict the scan; WHERE-clause fragments are evaluated on the joined row.
     *
     * @param outer whether the join is still outer
     * @return true if the filter cannot be pushed into the right-hand scan
     */
    public boolean isPostjoinFilter(boolean outer) {
        return outer && !isOnclause();
    }

    public double selectivity() {
        return selectivity;
    }

    public void setSelectivity(double selectivity) {
        this.selectivity = selectivity;
    }

    @Override
    public String toString() {
        return String.format("Filter(%s, keyspaces=%s, flags=%s)", fltrExpr.toSQL(), keyspaces, flags);
    }
}
