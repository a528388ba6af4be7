package io.largecollections.core;

import java.util.Properties;

/**
 * Immutable configuration shared by all chunked containers.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * LargeCollectionsConfiguration config = LargeCollectionsConfiguration.builder()
 *     .chunkSize(1 &lt;&lt; 20)
 *     .growFactor(2.0)
 *     .build();
 * </pre>
 * <p>
 * The chunk size bounds every contiguous Java array a container allocates. The largest
 * capacity a container may reach is {@code chunkSize * chunkSize}.
 *
 * @see GrowthPolicy
 * @see LoadFactorPolicy
 */
public final class LargeCollectionsConfiguration {

    /**
     * Largest array length the JVM reliably allocates.
     */
    public static final int MAX_CHUNK_SIZE = Integer.MAX_VALUE - 8;

    public static final String PROPERTY_PREFIX = "largecollections.";

    private static final LargeCollectionsConfiguration DEFAULTS = builder().build();

    // Storage layout
    private final int chunkSize;
    private final long maxCapacity;

    // Capacity policies
    private final GrowthPolicy growthPolicy;
    private final LoadFactorPolicy loadFactorPolicy;

    private LargeCollectionsConfiguration(Builder builder) {
        if (builder.chunkSize < 1 || builder.chunkSize > MAX_CHUNK_SIZE) {
            throw new InvalidConfigurationException(
                    "chunkSize must be in [1, " + MAX_CHUNK_SIZE + "]: " + builder.chunkSize);
        }
        this.chunkSize = builder.chunkSize;
        this.maxCapacity = (long) builder.chunkSize * (long) builder.chunkSize;
        this.growthPolicy = new GrowthPolicy(builder.growFactor, builder.fixedGrowAmount, builder.fixedGrowLimit);
        this.loadFactorPolicy = new LoadFactorPolicy(
                builder.minLoadFactor, builder.maxLoadFactor, builder.minLoadFactorTolerance);
    }

    /**
     * Create a new builder for LargeCollectionsConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration with the reference chunk size and policy defaults.
     */
    public static LargeCollectionsConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Bind a configuration from {@code largecollections.*} properties.
     * <p>
     * Recognised keys: {@code chunk-size}, {@code grow-factor}, {@code fixed-grow-amount},
     * {@code fixed-grow-limit}, {@code min-load-factor}, {@code max-load-factor},
     * {@code min-load-factor-tolerance}. Missing keys keep their defaults.
     *
     * @param properties source properties
     * @return the bound configuration
     * @throws InvalidConfigurationException if a value cannot be parsed or is out of range
     */
    public static LargeCollectionsConfiguration fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties required");
        }
        Builder builder = builder();
        String value;
        if ((value = property(properties, "chunk-size")) != null) {
            builder.chunkSize(parseInt("chunk-size", value));
        }
        if ((value = property(properties, "grow-factor")) != null) {
            builder.growFactor(parseDouble("grow-factor", value));
        }
        if ((value = property(properties, "fixed-grow-amount")) != null) {
            builder.fixedGrowAmount(parseLong("fixed-grow-amount", value));
        }
        if ((value = property(properties, "fixed-grow-limit")) != null) {
            builder.fixedGrowLimit(parseLong("fixed-grow-limit", value));
        }
        if ((value = property(properties, "min-load-factor")) != null) {
            builder.minLoadFactor(parseDouble("min-load-factor", value));
        }
        if ((value = property(properties, "max-load-factor")) != null) {
            builder.maxLoadFactor(parseDouble("max-load-factor", value));
        }
        if ((value = property(properties, "min-load-factor-tolerance")) != null) {
            builder.minLoadFactorTolerance(parseDouble("min-load-factor-tolerance", value));
        }
        return builder.build();
    }

    /**
     * Get the maximum number of elements held by one chunk.
     *
     * @return chunk size
     */
    public int chunkSize() {
        return chunkSize;
    }

    /**
     * Get the largest capacity any container may reach ({@code chunkSize²}).
     *
     * @return maximum capacity
     */
    public long maxCapacity() {
        return maxCapacity;
    }

    public GrowthPolicy growthPolicy() {
        return growthPolicy;
    }

    public LoadFactorPolicy loadFactorPolicy() {
        return loadFactorPolicy;
    }

    @Override
    public String toString() {
        return "LargeCollectionsConfiguration{chunkSize=" + chunkSize
                + ", growthPolicy=" + growthPolicy
                + ", loadFactorPolicy=" + loadFactorPolicy + '}';
    }

    private static String property(Properties properties, String key) {
        String value = properties.getProperty(PROPERTY_PREFIX + key);
        return value == null ? null : value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(PROPERTY_PREFIX + key + " is not an integer: " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(PROPERTY_PREFIX + key + " is not an integer: " + value, e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(PROPERTY_PREFIX + key + " is not a number: " + value, e);
        }
    }

    /**
     * Builder for LargeCollectionsConfiguration.
     * <p>
     * Validation happens in {@link #build()}.
     */
    public static class Builder {
        private int chunkSize = MAX_CHUNK_SIZE;
        private double growFactor = GrowthPolicy.DEFAULT_GROW_FACTOR;
        private long fixedGrowAmount = GrowthPolicy.DEFAULT_FIXED_GROW_AMOUNT;
        private long fixedGrowLimit = GrowthPolicy.DEFAULT_FIXED_GROW_LIMIT;
        private double minLoadFactor = LoadFactorPolicy.DEFAULT_MIN_LOAD_FACTOR;
        private double maxLoadFactor = LoadFactorPolicy.DEFAULT_MAX_LOAD_FACTOR;
        private double minLoadFactorTolerance = LoadFactorPolicy.DEFAULT_MIN_LOAD_FACTOR_TOLERANCE;

        private Builder() {
        }

        /**
         * Set the maximum number of elements per chunk.
         *
         * @param chunkSize chunk size, in {@code [1, MAX_CHUNK_SIZE]}
         * @return this builder for method chaining
         */
        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        /**
         * Set the multiplicative growth factor used below the fixed grow limit.
         *
         * @param growFactor factor in {@code (1.0, 3.0]}
         * @return this builder for method chaining
         */
        public Builder growFactor(double growFactor) {
            this.growFactor = growFactor;
            return this;
        }

        public Builder fixedGrowAmount(long fixedGrowAmount) {
            this.fixedGrowAmount = fixedGrowAmount;
            return this;
        }

        public Builder fixedGrowLimit(long fixedGrowLimit) {
            this.fixedGrowLimit = fixedGrowLimit;
            return this;
        }

        public Builder minLoadFactor(double minLoadFactor) {
            this.minLoadFactor = minLoadFactor;
            return this;
        }

        public Builder maxLoadFactor(double maxLoadFactor) {
            this.maxLoadFactor = maxLoadFactor;
            return this;
        }

        /**
         * Set the multiplier applied to the minimum load factor before a hash table shrinks.
         *
         * @param minLoadFactorTolerance non-negative tolerance
         * @return this builder for method chaining
         */
        public Builder minLoadFactorTolerance(double minLoadFactorTolerance) {
            this.minLoadFactorTolerance = minLoadFactorTolerance;
            return this;
        }

        /**
         * Build the immutable LargeCollectionsConfiguration.
         *
         * @return a new LargeCollectionsConfiguration instance
         * @throws InvalidConfigurationException if any parameter is out of range
         */
        public LargeCollectionsConfiguration build() {
            return new LargeCollectionsConfiguration(this);
        }
    }
}
