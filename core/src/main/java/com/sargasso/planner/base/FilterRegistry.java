package com.sargasso.planner.base;

import com.sargasso.exception.PlanInternalException;
import com.sargasso.expression.Expression;
import com.sargasso.expression.Expressions;
import com.sargasso.expression.Normalizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-alias planning state of one statement.
 *
 * <p>Invariant: a filter referring to exactly one alias is in that alias's
 * filter list; a filter referring to several aliases is in the join filter list
 * of every alias it refers to, as one shared instance.
 */
public final class FilterRegistry {

    private static final Logger logger = LoggerFactory.getLogger(FilterRegistry.class);

    private final Map<String, BaseKeyspace> keyspaces = new LinkedHashMap<>();

    /**
     * Registers a keyspace.
     *
     * @param keyspace the keyspace entry
     * @throws PlanInternalException if the alias is already registered
     */
    public void add(BaseKeyspace keyspace) {
        if (keyspaces.putIfAbsent(keyspace.alias(), keyspace) != null) {
            throw new PlanInternalException("Duplicate alias in FROM clause", keyspace.alias());
        }
    }

    /**
     * Returns the entry of an alias that must be registered.
     *
     * @param alias the alias
     * @return the entry
     * @throws PlanInternalException if the alias is unknown
     */
    public BaseKeyspace get(String alias) {
        BaseKeyspace keyspace = keyspaces.get(alias);
        if (keyspace == null) {
            throw new PlanInternalException("Keyspace missing from filter registry", alias);
        }
        return keyspace;
    }

    public Optional<BaseKeyspace> find(String alias) {
        return Optional.ofNullable(keyspaces.get(alias));
    }

    public boolean contains(String alias) {
        return keyspaces.containsKey(alias);
    }

    /**
     * Returns the registered aliases in FROM-clause order.
     */
    public Set<String> aliases() {
        return Collections.unmodifiableSet(keyspaces.keySet());
    }

    public Collection<BaseKeyspace> keyspaces() {
        return Collections.unmodifiableCollection(keyspaces.values());
    }

    /**
     * Returns the aliases already planned.
     */
    public Set<String> plannedAliases() {
        Set<String> planned = new LinkedHashSet<>();
        for (BaseKeyspace keyspace : keyspaces.values()) {
            if (keyspace.isPlanDone()) {
                planned.add(keyspace.alias());
            }
        }
        return planned;
    }

    /**
     * Copies the registry.
     *
     * @param withFilters whether to copy the filters; a copy without filters is a
     *                    scratch registry for classifying a fragment in isolation
     * @return the copy
     */
    public FilterRegistry copy(boolean withFilters) {
        FilterRegistry copy = new FilterRegistry();
        Map<Filter, Filter> copies = withFilters ? new IdentityHashMap<>() : null;
        for (BaseKeyspace keyspace : keyspaces.values()) {
            copy.keyspaces.put(keyspace.alias(), keyspace.copy(copies));
        }
        return copy;
    }

    /**
     * Attaches a classified filter to the keyspaces it refers to.
     *
     * @param filter the filter
     */
    public void attach(Filter filter) {
        Set<String> refs = filter.keyspaces();
        if (refs.size() == 1) {
            get(refs.iterator().next()).addFilter(filter);
        } else {
            for (String alias : refs) {
                get(alias).addJoinFilter(filter);
            }
        }
    }

    /**
     * Returns the unnest terms that depend on an alias, directly or through other unnests.
     *
     * @param alias the alias
     * @return the aliases of dependent unnest terms
     */
    public Set<String> dependentUnnests(String alias) {
        Set<String> sources = new LinkedHashSet<>();
        sources.add(alias);
        Set<String> result = new LinkedHashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (BaseKeyspace keyspace : keyspaces.values()) {
                if (keyspace.isUnnest() && !sources.contains(keyspace.alias())
                    && Expressions.references(keyspace.unnestExpr(), sources)) {
                    sources.add(keyspace.alias());
                    result.add(keyspace.alias());
                    changed = true;
                }
            }
        }
        return result;
    }

    /**
     * Updates join filters after a keyspace has been planned.
     *
     * <p>The planned alias is dropped from every join filter referring to it; a
     * join filter left with a single alias moves to that alias's filter list.
     *
     * @param planned the alias just planned
     */
    public void moveJoinFilters(String planned) {
        List<Filter> moved = new ArrayList<>();
        for (BaseKeyspace keyspace : keyspaces.values()) {
            for (Filter filter : keyspace.joinFilters()) {
                if (filter.keyspaces().contains(planned)) {
                    filter.removeKeyspace(planned);
                }
                if (filter.keyspaces().size() <= 1 && !moved.contains(filter)) {
                    moved.add(filter);
                }
            }
        }
        for (Filter filter : moved) {
            for (BaseKeyspace keyspace : keyspaces.values()) {
                keyspace.removeJoinFilter(filter);
            }
            Iterator<String> remaining = filter.keyspaces().iterator();
            if (remaining.hasNext()) {
                String alias = remaining.next();
                get(alias).addFilter(filter);
                logger.debug("Moved join filter {} to keyspace {}", filter.fltrExpr(), alias);
            }
        }
    }

    /**
     * Builds the combined predicates of a keyspace from its filters.
     *
     * <p>While the keyspace is on the subservient side of an outer join only
     * ON-clause filters take part. Join filters are left out when the keyspace is
     * built independently for a hash join.
     *
     * @param keyspace the keyspace
     * @param excludeJoinFilters whether to leave out filters that came from join predicates
     * @param maxDnfComplexity the bound on DNF expansion
     */
    public void combineFilters(BaseKeyspace keyspace, boolean excludeJoinFilters, int maxDnfComplexity) {
        List<Expression> fltrExprs = new ArrayList<>();
        List<Expression> origExprs = new ArrayList<>();
        List<Expression> onclauseExprs = new ArrayList<>();
        boolean outer = keyspace.outerLevel() > 0;
        for (Filter filter : keyspace.filters()) {
            if (excludeJoinFilters && filter.isJoin()) {
                continue;
            }
            if (filter.isPostjoinFilter(outer)) {
                continue;
            }
            fltrExprs.add(filter.fltrExpr());
            if (!filter.isDerived()) {
                origExprs.add(filter.origExpr());
            }
            if (filter.isOnclause()) {
                onclauseExprs.add(filter.origExpr());
            }
        }
        Expression dnfPred = fltrExprs.isEmpty()
            ? null : Normalizer.dnf(Expressions.and(fltrExprs), maxDnfComplexity);
        Expression origPred = origExprs.isEmpty() ? null : Expressions.and(origExprs);
        Expression onclause = onclauseExprs.isEmpty() ? null : Expressions.and(onclauseExprs);
        keyspace.setPredicates(dnfPred, origPred, onclause);
        if (outer) {
            keyspace.setFlag(BaseKeyspace.Flag.ONCLAUSE_ONLY);
        } else {
            keyspace.unsetFlag(BaseKeyspace.Flag.ONCLAUSE_ONLY);
        }
    }

    /**
     * Clears the transient flags of every filter.
     */
    public void clearTransientFlags() {
        for (BaseKeyspace keyspace : keyspaces.values()) {
            for (Filter filter : keyspace.filters()) {
                filter.clearTransientFlags();
            }
            for (Filter filter : keyspace.joinFilters()) {
                filter.clearTransientFlags();
            }
        }
    }

    @Override
    public String toString() {
        return "FilterRegistry" + keyspaces.values();
    }
}
