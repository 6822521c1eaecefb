package com.sargasso.planner.sarg;

import com.sargasso.catalog.IndexKey;
import com.sargasso.expression.Expression;
import java.util.List;

/**
 * Counts the leading index keys a predicate can use.
 */
public final class SargableChecker {

    private SargableChecker() {} // Utility class

    /**
     * Returns the number of leading keys the predicate relates to.
     *
     * <p>An index has no entry for a document whose leading key is MISSING, so a
     * leading key is not usable by a predicate that must see MISSING keys.
     *
     * @param pred the predicate over the scanned alias
     * @param keys the index keys formalized to the alias
     * @param alias the scanned alias
     * @param join whether the scan runs under a nested-loop join
     * @param fanout the IN-list fan-out limit
     * @return the number of leading sargable keys, 0 if the index is unusable
     */
    public static int sargableKeys(Expression pred, List<IndexKey> keys, String alias, boolean join, int fanout) {
        int count = 0;
        for (IndexKey key : keys) {
            SargSpans spans = new KeySarger(key, alias, join, fanout).sarg(pred);
            if (spans == null) {
                break;
            }
            if (count == 0 && spans == SentinelSpans.WHOLE) {
                break;
            }
            count++;
        }
        return count;
    }
}
