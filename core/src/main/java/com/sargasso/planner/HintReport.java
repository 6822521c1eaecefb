package com.sargasso.planner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects hint warnings raised while planning one statement.
 */
public final class HintReport {

    private static final Logger logger = LoggerFactory.getLogger(HintReport.class);

    private final List<HintWarning> warnings = new ArrayList<>();

    /**
     * Records a hint that was not followed.
     *
     * @param alias the alias the hint is attached to
     * @param hint the hint text
     * @param reason why it was not followed
     */
    public void warn(String alias, String hint, String reason) {
        HintWarning warning = new HintWarning(alias, hint, reason);
        if (!warnings.contains(warning)) {
            warnings.add(warning);
            logger.warn("Hint not followed: {}", warning);
        }
    }

    public List<HintWarning> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }
}
