package com.sargasso.planner.base;

import com.sargasso.catalog.Catalog;
import com.sargasso.catalog.Keyspace;
import com.sargasso.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Planning state of one FROM term.
 *
 * <p>Holds the filters classified for the term, the combined predicates built
 * from them for index selection, the outer level (how many outer joins the term
 * is still on the subservient side of) and bookkeeping flags. Owned by a single
 * statement compilation.
 */
public final class BaseKeyspace {

    /**
     * Keyspace flags.
     */
    public enum Flag {
        PLAN_DONE,
        ONCLAUSE_ONLY,
        PRIMARY_TERM,
        PRIMARY_UNNEST,
        UNDER_NL,
        UNDER_HASH
    }

    private final String alias;
    private final String path;
    private final Expression unnestExpr;
    private final List<Filter> filters = new ArrayList<>();
    private final List<Filter> joinFilters = new ArrayList<>();
    private final EnumSet<Flag> flags = EnumSet.noneOf(Flag.class);
    private Expression dnfPred;
    private Expression origPred;
    private Expression onclause;
    private int outerLevel;
    private OptionalLong documentCount;

    /**
     * Creates a keyspace entry.
     *
     * @param alias the alias
     * @param path the catalog path, or null for expression, subquery and unnest terms
     * @param unnestExpr the unnested expression for unnest terms, otherwise null
     * @param outerLevel the initial outer level
     */
    public BaseKeyspace(String alias, String path, Expression unnestExpr, int outerLevel) {
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        this.path = path;
        this.unnestExpr = unnestExpr;
        this.outerLevel = outerLevel;
    }

    /**
     * Returns a copy of this entry, with copies of its filters or without filters.
     *
     * @param withFilters whether to copy the filter lists
     * @return the copy
     */
    public BaseKeyspace copy(boolean withFilters) {
        return copy(withFilters ? new IdentityHashMap<>() : null);
    }

    /**
     * Copies this entry; a filter shared by several keyspaces maps to one shared copy.
     */
    BaseKeyspace copy(Map<Filter, Filter> copies) {
        BaseKeyspace copy = new BaseKeyspace(alias, path, unnestExpr, outerLevel);
        copy.flags.addAll(flags);
        copy.documentCount = documentCount;
        if (copies != null) {
            for (Filter filter : filters) {
                copy.filters.add(copies.computeIfAbsent(filter, Filter::copy));
            }
            for (Filter filter : joinFilters) {
                copy.joinFilters.add(copies.computeIfAbsent(filter, Filter::copy));
            }
            copy.dnfPred = dnfPred;
            copy.origPred = origPred;
            copy.onclause = onclause;
        }
        return copy;
    }

    public String alias() {
        return alias;
    }

    /**
     * Returns the catalog path.
     *
     * @return the path, or null if the term is not a keyspace
     */
    public String path() {
        return path;
    }

    /**
     * Returns the unnested expression of an unnest term.
     *
     * @return the expression, or null if this is not an unnest term
     */
    public Expression unnestExpr() {
        return unnestExpr;
    }

    public boolean isUnnest() {
        return unnestExpr != null;
    }

    public List<Filter> filters() {
        return Collections.unmodifiableList(filters);
    }

    public List<Filter> joinFilters() {
        return Collections.unmodifiableList(joinFilters);
    }

    public void addFilter(Filter filter) {
        filters.add(Objects.requireNonNull(filter, "filter must not be null"));
    }

    public void addJoinFilter(Filter filter) {
        joinFilters.add(Objects.requireNonNull(filter, "filter must not be null"));
    }

    boolean removeJoinFilter(Filter filter) {
        return joinFilters.remove(filter);
    }

    /**
     * Returns the combined single-keyspace predicate used for index selection.
     *
     * @return the predicate in bounded DNF, or null if there is none
     */
    public Expression dnfPred() {
        return dnfPred;
    }

    /**
     * Returns the combined predicate as written.
     */
    public Expression origPred() {
        return origPred;
    }

    /**
     * Returns the combined ON-clause fragments of this keyspace.
     */
    public Expression onclause() {
        return onclause;
    }

    void setPredicates(Expression dnfPred, Expression origPred, Expression onclause) {
        this.dnfPred = dnfPred;
        this.origPred = origPred;
        this.onclause = onclause;
    }

    public int outerLevel() {
        return outerLevel;
    }

    public void decrementOuterLevel() {
        if (outerLevel > 0) {
            outerLevel--;
        }
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

    public boolean isPlanDone() {
        return flags.contains(Flag.PLAN_DONE);
    }

    /**
     * Returns the keyspace's document count, fetched from the catalog once.
     *
     * @param catalog the catalog
     * @return the count, or empty if the term is not a keyspace or has no statistics
     */
    public OptionalLong documentCount(Catalog catalog) {
        if (documentCount == null) {
            documentCount = OptionalLong.empty();
            if (path != null) {
                Optional<Keyspace> keyspace = catalog.keyspace(path);
                if (keyspace.isPresent()) {
                    documentCount = keyspace.get().documentCount();
                }
            }
        }
        return documentCount;
    }

    @Override
    public String toString() {
        return String.format("BaseKeyspace(%s, path=%s, filters=%d, joinFilters=%d, outerLevel=%d, flags=%s)",
            alias, path, filters.size(), joinFilters.size(), outerLevel, flags);
    }
}
