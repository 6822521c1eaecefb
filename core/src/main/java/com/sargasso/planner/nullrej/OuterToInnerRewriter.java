package com.sargasso.planner.nullrej;

import com.sargasso.algebra.AnsiJoin;
import com.sargasso.algebra.FromTerm;
import com.sargasso.algebra.SimpleTerm;
import com.sargasso.algebra.Unnest;
import com.sargasso.planner.PlanContext;
import com.sargasso.planner.base.BaseKeyspace;
import com.sargasso.planner.base.Filter;
import com.sargasso.planner.base.FilterRegistry;
import com.sargasso.planner.classify.ExprClassifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns outer ANSI joins and nests into inner ones where the predicates already
 * classified into the registry reject the rows the outer join would add.
 *
 * <p>Only WHERE-clause fragments and ON clauses of inner joins are in the
 * registry when the rewrite runs. A converted join's ON clause is classified as
 * an ordinary predicate, which can in turn null-reject an earlier outer join, so
 * the FROM tree is walked until nothing changes.
 */
public final class OuterToInnerRewriter {

    private static final Logger logger = LoggerFactory.getLogger(OuterToInnerRewriter.class);

    private final FilterRegistry registry;
    private final PlanContext context;

    public OuterToInnerRewriter(FilterRegistry registry, PlanContext context) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    /**
     * Rewrites the outer joins of a FROM tree in place.
     *
     * @param from the FROM tree
     * @return the joins that were turned into inner joins, in the order they were converted
     */
    public List<AnsiJoin> rewrite(FromTerm from) {
        List<AnsiJoin> converted = new ArrayList<>();
        boolean changed = true;
        while (changed) {
            changed = visit(from, converted);
        }
        return converted;
    }

    private boolean visit(FromTerm term, List<AnsiJoin> converted) {
        if (term instanceof SimpleTerm) {
            return false;
        }
        if (term instanceof Unnest) {
            return visit(((Unnest) term).left(), converted);
        }
        AnsiJoin join = (AnsiJoin) term;
        boolean changed = visit(join.left(), converted);
        if (join.isOuter() && isNullRejected(join.alias())) {
            join.setOuter(false);
            registry.get(join.alias()).decrementOuterLevel();
            new ExprClassifier(registry, context, false).classify(join.onclause());
            converted.add(join);
            logger.debug("Converted outer {} on {} to inner", join.kind(), join.alias());
            changed = true;
        }
        return changed;
    }

    /**
     * Checks the filters of an outer-joined alias and of the unnests hanging off it.
     */
    private boolean isNullRejected(String alias) {
        List<String> aliases = new ArrayList<>();
        aliases.add(alias);
        aliases.addAll(registry.dependentUnnests(alias));
        for (String candidate : aliases) {
            BaseKeyspace keyspace = registry.get(candidate);
            for (Filter filter : keyspace.filters()) {
                if (NullRejectionChecker.isNullRejecting(filter.fltrExpr(), candidate)) {
                    return true;
                }
            }
            for (Filter filter : keyspace.joinFilters()) {
                if (NullRejectionChecker.isNullRejecting(filter.fltrExpr(), candidate)) {
                    return true;
                }
            }
        }
        return false;
    }
}
