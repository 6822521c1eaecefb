package com.sargasso.planner.sarg;

import com.sargasso.catalog.IndexKey;
import com.sargasso.expression.Expression;
import com.sargasso.expression.Expressions;
import com.sargasso.expression.Or;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the spans of a composite index for a predicate.
 *
 * <p>Each conjunct is matched against each leading key and the per-key spans are
 * composed in key order. A top-level OR becomes a union of the composite spans
 * of its disjuncts. An OR conjunct that constrains several keys is built the
 * same way and intersected with the spans of the other conjuncts, which keeps
 * its branches paired instead of crossing them key by key.
 *
 * <p>Example, index on {@code (x, y)}:
 * <pre>
 *   (x = 1 AND y = 2) OR (x = 3 AND y = 4)
 *     =&gt; Union[Term[{[1], [2]}], Term[{[3], [4]}]]
 * </pre>
 */
public final class SargBuilder {

    private static final Logger logger = LoggerFactory.getLogger(SargBuilder.class);

    private final List<KeySarger> sargers;

    private SargBuilder(List<KeySarger> sargers) {
        this.sargers = sargers;
    }

    /**
     * Returns the streamlined spans of the leading keys of an index.
     *
     * @param pred the predicate over the scanned alias
     * @param keys the index keys formalized to the alias
     * @param sargKeys the number of leading keys to use
     * @param alias the scanned alias
     * @param join whether the scan runs under a nested-loop join
     * @param fanout the span fan-out limit
     * @return the spans
     */
    public static SargSpans sargFor(Expression pred, List<IndexKey> keys, int sargKeys,
                                    String alias, boolean join, int fanout) {
        List<KeySarger> sargers = new ArrayList<>(sargKeys);
        for (int i = 0; i < sargKeys && i < keys.size(); i++) {
            sargers.add(new KeySarger(keys.get(i), alias, join, fanout));
        }
        SargBuilder builder = new SargBuilder(sargers);
        SargSpans spans = SpanAlgebra.streamline(builder.build(pred, fanout));
        logger.debug("Spans of {} on {} keys for {}: {}", alias, sargers.size(), pred, spans);
        return spans;
    }

    private SargSpans build(Expression pred, int fanout) {
        if (pred instanceof Or) {
            return buildOr((Or) pred, fanout);
        }
        return buildAnd(pred, fanout);
    }

    private SargSpans buildOr(Or pred, int fanout) {
        List<SargSpans> branches = new ArrayList<>();
        for (Expression disjunct : Expressions.flattenOr(pred)) {
            branches.add(buildAnd(disjunct, fanout));
        }
        return SpanAlgebra.union(branches);
    }

    private SargSpans buildAnd(Expression pred, int fanout) {
        List<Expression> simple = new ArrayList<>();
        List<SargSpans> parts = new ArrayList<>();
        for (Expression conjunct : Expressions.flattenAnd(pred)) {
            if (conjunct instanceof Or && relatedKeys(conjunct) > 1) {
                parts.add(buildOr((Or) conjunct, fanout));
            } else {
                simple.add(conjunct);
            }
        }
        if (!simple.isEmpty()) {
            parts.add(0, composite(simple, fanout));
        }
        return SpanAlgebra.intersect(parts);
    }

    private int relatedKeys(Expression pred) {
        int related = 0;
        for (KeySarger sarger : sargers) {
            if (sarger.sarg(pred) != null) {
                related++;
            }
        }
        return related;
    }

    /**
     * Composes the per-key spans of a conjunction. Composition stops at the first
     * key no conjunct relates to; conjuncts no key relates to leave the spans
     * inexact.
     */
    private SargSpans composite(List<Expression> conjuncts, int fanout) {
        boolean[] used = new boolean[conjuncts.size()];
        SargSpans result = null;
        for (KeySarger sarger : sargers) {
            SargSpans keySpans = null;
            for (int i = 0; i < conjuncts.size(); i++) {
                SargSpans spans = sarger.sarg(conjuncts.get(i));
                if (spans == null) {
                    continue;
                }
                used[i] = true;
                keySpans = keySpans == null ? spans : SpanAlgebra.constrain(keySpans, spans);
            }
            if (keySpans == null) {
                break;
            }
            result = result == null ? keySpans : SpanAlgebra.compose(result, keySpans, fanout);
        }
        if (result == null) {
            return SentinelSpans.FULL;
        }
        for (boolean u : used) {
            if (!u) {
                return SpanAlgebra.inexact(result);
            }
        }
        return result;
    }
}
