package com.sargasso.planner.sarg;

/**
 * Which bounds of a key range are inclusive.
 */
public enum Inclusion {
    NEITHER,
    LOW,
    HIGH,
    BOTH;

    public static Inclusion of(boolean low, boolean high) {
        if (low) {
            return high ? BOTH : LOW;
        }
        return high ? HIGH : NEITHER;
    }

    public boolean includesLow() {
        return this == LOW || this == BOTH;
    }

    public boolean includesHigh() {
        return this == HIGH || this == BOTH;
    }
}
