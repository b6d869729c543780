package io.roarindex.core;

/**
 * Immutable configuration for a {@link io.roarindex.index.RoarIndex}.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * RoarIndexConfiguration config = RoarIndexConfiguration.builder()
 *     .initialKeyCapacity(4096)
 *     .runOptimizeOnAdd(true)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 *
 * @see io.roarindex.index.RoarIndex
 */
public final class RoarIndexConfiguration {

    private static final int DEFAULT_INITIAL_CAPACITY = 16;

    // Interner and posting store sizing
    private final int initialKeyCapacity;
    private final int initialValueCapacity;

    // Bitmap compaction
    private final boolean runOptimizeOnAdd;

    // Guard
    private final boolean fairLock;

    private RoarIndexConfiguration(Builder builder) {
        this.initialKeyCapacity = builder.initialKeyCapacity;
        this.initialValueCapacity = builder.initialValueCapacity;
        this.runOptimizeOnAdd = builder.runOptimizeOnAdd;
        this.fairLock = builder.fairLock;
    }

    /**
     * Create a new builder for RoarIndexConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration with every option at its default.
     */
    public static RoarIndexConfiguration defaults() {
        return builder().build();
    }

    /**
     * Initial capacity of the key interner and the posting store.
     *
     * @return initial key capacity
     */
    public int initialKeyCapacity() {
        return initialKeyCapacity;
    }

    /**
     * Initial capacity of the value interner.
     *
     * @return initial value capacity
     */
    public int initialValueCapacity() {
        return initialValueCapacity;
    }

    /**
     * Check if posting sets are run-length compacted after each insertion.
     *
     * @return true if every add is followed by a run optimization (default: false)
     */
    public boolean runOptimizeOnAdd() {
        return runOptimizeOnAdd;
    }

    /**
     * Check if the read/write guard uses a fair ordering policy.
     *
     * @return true for a fair lock (default: false)
     */
    public boolean fairLock() {
        return fairLock;
    }

    @Override
    public String toString() {
        return "RoarIndexConfiguration{initialKeyCapacity=" + initialKeyCapacity
                + ", initialValueCapacity=" + initialValueCapacity
                + ", runOptimizeOnAdd=" + runOptimizeOnAdd
                + ", fairLock=" + fairLock + "}";
    }

    /**
     * Builder for RoarIndexConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private int initialKeyCapacity = DEFAULT_INITIAL_CAPACITY;
        private int initialValueCapacity = DEFAULT_INITIAL_CAPACITY;
        private boolean runOptimizeOnAdd;
        private boolean fairLock;

        private Builder() {
        }

        /**
         * Set the initial capacity of the key interner and posting store.
         *
         * @param initialKeyCapacity expected number of distinct keys
         * @return this builder for method chaining
         */
        public Builder initialKeyCapacity(int initialKeyCapacity) {
            if (initialKeyCapacity < 0) {
                throw new IllegalArgumentException("initialKeyCapacity must be non-negative");
            }
            this.initialKeyCapacity = initialKeyCapacity;
            return this;
        }

        /**
         * Set the initial capacity of the value interner.
         *
         * @param initialValueCapacity expected number of distinct values
         * @return this builder for method chaining
         */
        public Builder initialValueCapacity(int initialValueCapacity) {
            if (initialValueCapacity < 0) {
                throw new IllegalArgumentException("initialValueCapacity must be non-negative");
            }
            this.initialValueCapacity = initialValueCapacity;
            return this;
        }

        /**
         * Enable or disable run-length compaction after every insertion.
         *
         * @param runOptimizeOnAdd true to compact on each add
         * @return this builder for method chaining
         */
        public Builder runOptimizeOnAdd(boolean runOptimizeOnAdd) {
            this.runOptimizeOnAdd = runOptimizeOnAdd;
            return this;
        }

        /**
         * Select the fairness policy of the read/write guard.
         *
         * @param fairLock true for a fair lock
         * @return this builder for method chaining
         */
        public Builder fairLock(boolean fairLock) {
            this.fairLock = fairLock;
            return this;
        }

        /**
         * Build the configuration.
         *
         * @return the immutable configuration
         */
        public RoarIndexConfiguration build() {
            return new RoarIndexConfiguration(this);
        }
    }
}
