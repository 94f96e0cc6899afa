package io.tabula.core;

/**
 * Immutable configuration for path compilation and row access.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * TabulaConfiguration config = TabulaConfiguration.builder()
 *     .accessStrategy(AccessStrategy.STEPWISE)
 *     .memberVisibility(MemberVisibility.PUBLIC)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 */
public final class TabulaConfiguration {

    private static final TabulaConfiguration DEFAULTS = builder().build();

    private final AccessStrategy accessStrategy;
    private final MemberVisibility memberVisibility;
    private final boolean stringFallback;

    private TabulaConfiguration(Builder builder) {
        this.accessStrategy = builder.accessStrategy;
        this.memberVisibility = builder.memberVisibility;
        this.stringFallback = builder.stringFallback;
    }

    /**
     * Create a new builder for TabulaConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The configuration used when none is given.
     *
     * @return shared default configuration
     */
    public static TabulaConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Get the row access strategy.
     *
     * @return the access strategy (FUSED or STEPWISE)
     */
    public AccessStrategy accessStrategy() {
        return accessStrategy;
    }

    /**
     * Get which members a path segment may resolve to.
     *
     * @return member visibility (ALL or PUBLIC)
     */
    public MemberVisibility memberVisibility() {
        return memberVisibility;
    }

    /**
     * Check if terminal types without a value kind fall back to their {@code toString()}.
     *
     * @return true if the string fallback is enabled (default: true)
     */
    public boolean stringFallback() {
        return stringFallback;
    }

    @Override
    public String toString() {
        return "TabulaConfiguration[accessStrategy=" + accessStrategy
                + ", memberVisibility=" + memberVisibility
                + ", stringFallback=" + stringFallback + "]";
    }

    /**
     * How compiled paths are walked for each row.
     */
    public enum AccessStrategy {
        /**
         * Compose all steps of a path into one method handle chain when binding.
         * Fewest indirections per row.
         */
        FUSED,

        /**
         * Interpret the step list for every row.
         * Simplest to debug, one virtual dispatch per step.
         */
        STEPWISE
    }

    /**
     * Which fields and accessors a segment may name.
     */
    public enum MemberVisibility {
        /**
         * Any non-static member, including private ones read through a private lookup.
         */
        ALL,

        /**
         * Public members only.
         */
        PUBLIC
    }

    /**
     * Builder for TabulaConfiguration.
     */
    public static class Builder {
        private AccessStrategy accessStrategy = AccessStrategy.FUSED;
        private MemberVisibility memberVisibility = MemberVisibility.ALL;
        private boolean stringFallback = true;

        private Builder() {
        }

        /**
         * Set the row access strategy.
         *
         * @param accessStrategy the strategy
         * @return this builder for method chaining
         */
        public Builder accessStrategy(AccessStrategy accessStrategy) {
            if (accessStrategy == null) {
                throw new IllegalArgumentException("accessStrategy required");
            }
            this.accessStrategy = accessStrategy;
            return this;
        }

        /**
         * Set which members path segments may resolve to.
         *
         * @param memberVisibility the visibility
         * @return this builder for method chaining
         */
        public Builder memberVisibility(MemberVisibility memberVisibility) {
            if (memberVisibility == null) {
                throw new IllegalArgumentException("memberVisibility required");
            }
            this.memberVisibility = memberVisibility;
            return this;
        }

        /**
         * Enable or disable the {@code toString()} fallback for terminal types without a kind.
         * When disabled, such columns are rejected at compile time.
         *
         * @param stringFallback true to enable the fallback (default: true)
         * @return this builder for method chaining
         */
        public Builder stringFallback(boolean stringFallback) {
            this.stringFallback = stringFallback;
            return this;
        }

        /**
         * Build the immutable TabulaConfiguration.
         *
         * @return a new TabulaConfiguration instance
         */
        public TabulaConfiguration build() {
            return new TabulaConfiguration(this);
        }
    }
}
