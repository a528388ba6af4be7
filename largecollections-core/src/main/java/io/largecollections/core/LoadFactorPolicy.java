package io.largecollections.core;

/**
 * Load-factor thresholds for hash containers.
 * <p>
 * A table grows once {@code count / capacity > maxLoadFactor} and shrinks once
 * {@code count / capacity <= minLoadFactor * minLoadFactorTolerance}.
 */
public record LoadFactorPolicy(double minLoadFactor, double maxLoadFactor, double minLoadFactorTolerance) {

    public static final double DEFAULT_MIN_LOAD_FACTOR = 0.5;
    public static final double DEFAULT_MAX_LOAD_FACTOR = 1.0;
    public static final double DEFAULT_MIN_LOAD_FACTOR_TOLERANCE = 0.1;

    public LoadFactorPolicy {
        if (!(minLoadFactor > 0.0) || Double.isInfinite(minLoadFactor)) {
            throw new InvalidConfigurationException("minLoadFactor must be positive and finite: " + minLoadFactor);
        }
        if (!(maxLoadFactor > 0.0) || Double.isInfinite(maxLoadFactor)) {
            throw new InvalidConfigurationException("maxLoadFactor must be positive and finite: " + maxLoadFactor);
        }
        if (minLoadFactor >= maxLoadFactor) {
            throw new InvalidConfigurationException(
                    "minLoadFactor must be less than maxLoadFactor: " + minLoadFactor + " >= " + maxLoadFactor);
        }
        if (!(minLoadFactorTolerance >= 0.0) || Double.isInfinite(minLoadFactorTolerance)) {
            throw new InvalidConfigurationException(
                    "minLoadFactorTolerance must be non-negative and finite: " + minLoadFactorTolerance);
        }
    }

    public static LoadFactorPolicy defaultPolicy() {
        return new LoadFactorPolicy(DEFAULT_MIN_LOAD_FACTOR, DEFAULT_MAX_LOAD_FACTOR, DEFAULT_MIN_LOAD_FACTOR_TOLERANCE);
    }

    public boolean shouldGrow(long count, long capacity) {
        return (double) count / (double) capacity > maxLoadFactor;
    }

    public boolean shouldShrink(long count, long capacity) {
        return (double) count / (double) capacity <= minLoadFactor * minLoadFactorTolerance;
    }

    /**
     * Smallest capacity that keeps {@code count} at or below the minimum load factor.
     */
    public long shrinkTarget(long count) {
        double target = Math.ceil(count / minLoadFactor);
        return target < 1.0 ? 1L : (long) target;
    }
}
