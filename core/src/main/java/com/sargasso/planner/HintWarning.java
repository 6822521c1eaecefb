package com.sargasso.planner;

import java.util.Objects;

/**
 * A hint that could not be followed. Planning continues without it.
 *
 * @param alias the alias the hint is attached to
 * @param hint the hint text
 * @param reason why the hint was not followed
 */
public record HintWarning(String alias, String hint, String reason) {

    public HintWarning {
        Objects.requireNonNull(alias, "alias must not be null");
        Objects.requireNonNull(hint, "hint must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    @Override
    public String toString() {
        return hint + " on " + alias + ": " + reason;
    }
}
