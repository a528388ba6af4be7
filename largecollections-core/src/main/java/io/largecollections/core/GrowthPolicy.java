package io.largecollections.core;

/**
 * Hybrid capacity growth rule.
 * <p>
 * Below {@code fixedGrowLimit} the capacity grows multiplicatively
 * ({@code floor(capacity * growFactor) + 1}); at or above it the capacity grows by
 * {@code fixedGrowAmount}. The result never exceeds the supplied maximum.
 *
 * @param growFactor      multiplicative factor, in {@code (1.0, MAX_GROW_FACTOR]}
 * @param fixedGrowAmount additive step once the limit is reached, at least 1
 * @param fixedGrowLimit  capacity at which growth switches to additive, at least 1
 */
public record GrowthPolicy(double growFactor, long fixedGrowAmount, long fixedGrowLimit) {

    public static final double MAX_GROW_FACTOR = 3.0;
    public static final double DEFAULT_GROW_FACTOR = 1.4;
    public static final long DEFAULT_FIXED_GROW_AMOUNT = 100L * 1024L * 1024L;
    public static final long DEFAULT_FIXED_GROW_LIMIT = 50L * 1024L * 1024L;

    public GrowthPolicy {
        if (!(growFactor > 1.0) || growFactor > MAX_GROW_FACTOR) {
            throw new InvalidConfigurationException(
                    "growFactor must be in (1.0, " + MAX_GROW_FACTOR + "]: " + growFactor);
        }
        if (fixedGrowAmount < 1L) {
            throw new InvalidConfigurationException("fixedGrowAmount must be positive: " + fixedGrowAmount);
        }
        if (fixedGrowLimit < 1L) {
            throw new InvalidConfigurationException("fixedGrowLimit must be positive: " + fixedGrowLimit);
        }
    }

    public static GrowthPolicy defaultPolicy() {
        return new GrowthPolicy(DEFAULT_GROW_FACTOR, DEFAULT_FIXED_GROW_AMOUNT, DEFAULT_FIXED_GROW_LIMIT);
    }

    /**
     * Compute the next capacity.
     *
     * @param capacity    current capacity (non-negative)
     * @param maxCapacity upper bound for the result
     * @return grown capacity, clamped to {@code maxCapacity}
     */
    public long grow(long capacity, long maxCapacity) {
        if (capacity >= maxCapacity) {
            return maxCapacity;
        }
        if (capacity >= fixedGrowLimit) {
            // capacity + fixedGrowAmount may overflow
            return capacity > maxCapacity - fixedGrowAmount ? maxCapacity : capacity + fixedGrowAmount;
        }
        double scaled = Math.floor(capacity * growFactor);
        if (scaled >= maxCapacity) {
            return maxCapacity;
        }
        return Math.min((long) scaled + 1L, maxCapacity);
    }
}
