package io.largecollections.core;

/**
 * Thrown when a requested or resulting capacity lies outside {@code [0, maxCapacity]},
 * or when an insertion is attempted on a container that already holds the maximum count.
 */
public class CapacityExceededException extends LargeCollectionsException {

    private final long requested;
    private final long maxCapacity;

    public CapacityExceededException(long requested, long maxCapacity) {
        super("capacity out of range: " + requested + " (allowed 0.." + maxCapacity + ")");
        this.requested = requested;
        this.maxCapacity = maxCapacity;
    }

    public long requested() {
        return requested;
    }

    public long maxCapacity() {
        return maxCapacity;
    }
}
