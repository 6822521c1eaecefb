package com.sargasso.planner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable planner settings.
 *
 * <p>Defaults can be overridden with system properties:
 * <ul>
 *   <li>{@code sargasso.planner.hashJoin} - allow hash joins (default true)</li>
 *   <li>{@code sargasso.planner.selectivity} - estimate filter selectivity (default true)</li>
 *   <li>{@code sargasso.planner.spanFanout} - most spans an IN list or a composite key may
 *       expand to (default 8192)</li>
 *   <li>{@code sargasso.planner.maxDnfComplexity} - most disjuncts a DNF expansion may produce
 *       (default 1024)</li>
 * </ul>
 * Malformed values are ignored with a warning.
 */
public final class PlannerConfig {

    private static final Logger logger = LoggerFactory.getLogger(PlannerConfig.class);

    public static final String PROP_HASH_JOIN = "sargasso.planner.hashJoin";
    public static final String PROP_SELECTIVITY = "sargasso.planner.selectivity";
    public static final String PROP_SPAN_FANOUT = "sargasso.planner.spanFanout";
    public static final String PROP_MAX_DNF_COMPLEXITY = "sargasso.planner.maxDnfComplexity";

    public static final boolean DEFAULT_HASH_JOIN = true;
    public static final boolean DEFAULT_SELECTIVITY = true;
    public static final int DEFAULT_SPAN_FANOUT = 8192;
    public static final int DEFAULT_MAX_DNF_COMPLEXITY = 1024;

    private final boolean hashJoinEnabled;
    private final boolean selectivityEnabled;
    private final int spanFanout;
    private final int maxDnfComplexity;

    private PlannerConfig(Builder builder) {
        this.hashJoinEnabled = builder.hashJoinEnabled;
        this.selectivityEnabled = builder.selectivityEnabled;
        this.spanFanout = builder.spanFanout;
        this.maxDnfComplexity = builder.maxDnfComplexity;
    }

    /**
     * Returns the built-in defaults, ignoring system properties.
     */
    public static PlannerConfig defaults() {
        return builder().build();
    }

    /**
     * Returns the defaults overridden by system properties.
     */
    public static PlannerConfig fromSystemProperties() {
        return builder()
            .hashJoinEnabled(booleanProperty(PROP_HASH_JOIN, DEFAULT_HASH_JOIN))
            .selectivityEnabled(booleanProperty(PROP_SELECTIVITY, DEFAULT_SELECTIVITY))
            .spanFanout(intProperty(PROP_SPAN_FANOUT, DEFAULT_SPAN_FANOUT))
            .maxDnfComplexity(intProperty(PROP_MAX_DNF_COMPLEXITY, DEFAULT_MAX_DNF_COMPLEXITY))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hashJoinEnabled() {
        return hashJoinEnabled;
    }

    public boolean selectivityEnabled() {
        return selectivityEnabled;
    }

    public int spanFanout() {
        return spanFanout;
    }

    public int maxDnfComplexity() {
        return maxDnfComplexity;
    }

    @Override
    public String toString() {
        return String.format("PlannerConfig(hashJoin=%s, selectivity=%s, spanFanout=%d, maxDnfComplexity=%d)",
            hashJoinEnabled, selectivityEnabled, spanFanout, maxDnfComplexity);
    }

    // ========== Configuration Helpers ==========

    private static boolean booleanProperty(String name, boolean defaultValue) {
        String value = System.getProperty(name);
        if (value == null) {
            return defaultValue;
        }
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        logger.warn("Ignoring invalid boolean for {}: '{}', using {}", name, value, defaultValue);
        return defaultValue;
    }

    private static int intProperty(String name, int defaultValue) {
        String value = System.getProperty(name);
        if (value != null) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed > 0) {
                    return parsed;
                }
            } catch (NumberFormatException e) {
                // Ignore, use default
            }
            logger.warn("Ignoring invalid value for {}: '{}', using {}", name, value, defaultValue);
        }
        return defaultValue;
    }

    /**
     * Builder for planner settings.
     */
    public static final class Builder {
        private boolean hashJoinEnabled = DEFAULT_HASH_JOIN;
        private boolean selectivityEnabled = DEFAULT_SELECTIVITY;
        private int spanFanout = DEFAULT_SPAN_FANOUT;
        private int maxDnfComplexity = DEFAULT_MAX_DNF_COMPLEXITY;

        private Builder() {}

        public Builder hashJoinEnabled(boolean hashJoinEnabled) {
            this.hashJoinEnabled = hashJoinEnabled;
            return this;
        }

        public Builder selectivityEnabled(boolean selectivityEnabled) {
            this.selectivityEnabled = selectivityEnabled;
            return this;
        }

        public Builder spanFanout(int spanFanout) {
            if (spanFanout <= 0) {
                throw new IllegalArgumentException("spanFanout must be positive: " + spanFanout);
            }
            this.spanFanout = spanFanout;
            return this;
        }

        public Builder maxDnfComplexity(int maxDnfComplexity) {
            if (maxDnfComplexity <= 0) {
                throw new IllegalArgumentException("maxDnfComplexity must be positive: " + maxDnfComplexity);
            }
            this.maxDnfComplexity = maxDnfComplexity;
            return this;
        }

        public PlannerConfig build() {
            return new PlannerConfig(this);
        }
    }
}
