package com.sargasso.planner.sarg;

import com.sargasso.expression.Expression;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prunes candidate indexes dominated by another candidate.
 *
 * <p>A candidate whose matched keys are a strict subset of another candidate's
 * matched keys is dropped. Of candidates matching the same keys, the one with
 * fewer keys in total is kept, ties going to the smaller index name.
 */
public final class MinimalIndexes {

    private static final Logger logger = LoggerFactory.getLogger(MinimalIndexes.class);

    private MinimalIndexes() {} // Utility class

    /**
     * Returns the candidates no other candidate dominates, in input order.
     *
     * @param entries the sargable candidates
     * @return the remaining candidates
     */
    public static List<IndexEntry> prune(List<IndexEntry> entries) {
        List<Set<Expression>> keySets = new ArrayList<>(entries.size());
        for (IndexEntry entry : entries) {
            keySets.add(new HashSet<>(entry.sargKeyExpressions()));
        }
        List<IndexEntry> kept = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            IndexEntry entry = entries.get(i);
            boolean dominated = false;
            for (int j = 0; j < entries.size() && !dominated; j++) {
                if (i != j && dominates(entries.get(j), keySets.get(j), entry, keySets.get(i))) {
                    dominated = true;
                    logger.debug("Pruned index {} in favour of {}", entry.name(), entries.get(j).name());
                }
            }
            if (!dominated) {
                kept.add(entry);
            }
        }
        return kept;
    }

    private static boolean dominates(IndexEntry other, Set<Expression> otherKeys,
                                     IndexEntry entry, Set<Expression> entryKeys) {
        if (!otherKeys.containsAll(entryKeys)) {
            return false;
        }
        if (otherKeys.size() > entryKeys.size()) {
            return true;
        }
        int otherSize = other.keys().size();
        int entrySize = entry.keys().size();
        if (otherSize != entrySize) {
            return otherSize < entrySize;
        }
        return other.name().compareTo(entry.name()) < 0;
    }
}
