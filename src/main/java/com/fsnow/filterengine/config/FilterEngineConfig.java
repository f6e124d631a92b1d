package com.fsnow.filterengine.config;

/**
 * Configuration for FilterEngine.
 * Use the builder pattern to create instances.
 */
public final class FilterEngineConfig {

    /**
     * Upper bound for maxConditionsPerFilter: truth tables are enumerated
     * exhaustively, so a filter at the ceiling evaluates about a million rows.
     */
    public static final int CONDITIONS_CEILING = 20;

    private final int maxConditionsPerFilter;
    private final double reindexThreshold;
    private final long reindexDelayMillis;

    private FilterEngineConfig(Builder builder) {
        this.maxConditionsPerFilter = builder.maxConditionsPerFilter;
        this.reindexThreshold = builder.reindexThreshold;
        this.reindexDelayMillis = builder.reindexDelayMillis;
    }

    /**
     * Creates a new builder for FilterEngineConfig.
     *
     * @return A new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a default configuration.
     *
     * @return A default configuration
     */
    public static FilterEngineConfig defaultConfig() {
        return new Builder().build();
    }

    public int getMaxConditionsPerFilter() {
        return maxConditionsPerFilter;
    }

    public double getReindexThreshold() {
        return reindexThreshold;
    }

    public long getReindexDelayMillis() {
        return reindexDelayMillis;
    }

    /**
     * Builder for FilterEngineConfig.
     */
    public static class Builder {
        private int maxConditionsPerFilter = 16;
        private double reindexThreshold = 0.1;
        private long reindexDelayMillis = 5000;

        private Builder() {}

        /**
         * Sets the maximum number of truth-table columns a single filter may use.
         * Canonicalization cost doubles with each additional column.
         * Default: 16
         *
         * @param max The limit, between 1 and {@link #CONDITIONS_CEILING}
         * @return this builder
         */
        public Builder maxConditionsPerFilter(int max) {
            if (max <= 0 || max > CONDITIONS_CEILING) {
                throw new IllegalArgumentException(
                        "Max conditions per filter must be between 1 and " + CONDITIONS_CEILING);
            }
            this.maxConditionsPerFilter = max;
            return this;
        }

        /**
         * Sets the share of removed test table slots that triggers a compaction.
         * Default: 0.1 (10%)
         *
         * @param threshold A ratio in ]0, 1]
         * @return this builder
         */
        public Builder reindexThreshold(double threshold) {
            if (threshold <= 0 || threshold > 1) {
                throw new IllegalArgumentException("Reindex threshold must be in ]0, 1]");
            }
            this.reindexThreshold = threshold;
            return this;
        }

        /**
         * Sets how long a compaction is deferred once the threshold is crossed,
         * letting bursts of removals complete first.
         * Default: 5000 (5 seconds)
         *
         * @param delayMillis The delay in milliseconds
         * @return this builder
         */
        public Builder reindexDelayMillis(long delayMillis) {
            if (delayMillis < 0) {
                throw new IllegalArgumentException("Reindex delay cannot be negative");
            }
            this.reindexDelayMillis = delayMillis;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return A new FilterEngineConfig instance
         */
        public FilterEngineConfig build() {
            return new FilterEngineConfig(this);
        }
    }

    @Override
    public String toString() {
        return String.format("FilterEngineConfig{maxConditionsPerFilter=%d, reindexThreshold=%.2f, " +
                           "reindexDelayMillis=%d}",
                           maxConditionsPerFilter, reindexThreshold,
                           reindexDelayMillis);
    }
}
