package io.unistr.core;

/**
 * Thrown when an arena cannot grow far enough to satisfy an allocation.
 */
public class ArenaExhaustedException extends UniqueStringsException {

    private final long requestedCapacity;

    public ArenaExhaustedException(long requestedCapacity, int maxCapacity) {
        super("Arena cannot grow to " + requestedCapacity + " bytes (max " + maxCapacity + ")");
        this.requestedCapacity = requestedCapacity;
    }

    public long requestedCapacity() {
        return requestedCapacity;
    }
}
