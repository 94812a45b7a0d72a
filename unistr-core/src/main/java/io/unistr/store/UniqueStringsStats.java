package io.unistr.store;

/**
 * Point-in-time counters of a store.
 *
 * @param state           lifecycle phase
 * @param distinctStrings number of distinct values stored
 * @param addCalls        number of successful {@code add} calls
 * @param dedupHits       {@code add} calls answered by an already stored value
 * @param usedBytes       committed arena bytes, terminators included
 * @param capacityBytes   reserved arena bytes
 * @param growthEvents    number of times the arena was enlarged
 */
public record UniqueStringsStats(
        StoreState state,
        int distinctStrings,
        long addCalls,
        long dedupHits,
        int usedBytes,
        int capacityBytes,
        int growthEvents) {

    /**
     * Share of {@code add} calls that found an existing value, 0 when nothing was added.
     */
    public double hitRatio() {
        return addCalls == 0 ? 0.0 : (double) dedupHits / addCalls;
    }

    /**
     * Reserved but uncommitted bytes.
     */
    public int slackBytes() {
        return capacityBytes - usedBytes;
    }
}
