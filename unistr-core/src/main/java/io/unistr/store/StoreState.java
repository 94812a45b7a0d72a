package io.unistr.store;

/**
 * Lifecycle phase of a unique-string store.
 * <pre>
 * BUILDING --freeze()--&gt; FROZEN
 * BUILDING | FROZEN --destroy()--&gt; DESTROYED
 * </pre>
 */
public enum StoreState {
    /** Accepts {@code add}; the dedup index exists. */
    BUILDING,
    /** Read-only; index discarded, arena compacted. */
    FROZEN,
    /** All storage released; handles are invalid. */
    DESTROYED
}
