package io.unistr.index;

import io.unistr.storage.StringArena;
import io.unistr.storage.UniqueStringHandle;

/**
 * Fingerprint-bucketed index of the values stored in an arena.
 * <p>
 * A fixed array of {@link #BUCKET_COUNT} heads, each the start of a singly linked
 * chain. Chains are kept in non-increasing unsigned fingerprint order: a new entry
 * is linked immediately before the first entry with a smaller fingerprint. A lookup
 * can therefore stop as soon as it walks past the slot its fingerprint would occupy,
 * and entries that share a fingerprint always sit next to each other.
 * <p>
 * <b>Thread-safety:</b> none.
 */
public final class EntryTable {

    public static final int BUCKET_COUNT = 32;

    private final StringArena arena;
    private Entry[] buckets = new Entry[BUCKET_COUNT];
    private int size;

    public EntryTable(StringArena arena) {
        this.arena = arena;
    }

    /**
     * Find the handle of a stored value equal to {@code bytes}, or store it.
     * <p>
     * On a miss the bytes plus a terminator are appended to the arena and a new
     * entry is linked into the bucket.
     *
     * @param fingerprint hash of {@code bytes}
     * @param bytes       value content, free of terminator bytes
     * @return result carrying the handle and whether it was already present
     */
    public Lookup findOrInsert(int fingerprint, byte[] bytes) {
        assertOpen();
        int bucket = bucketIndex(fingerprint);
        Entry previous = null;
        Entry current = buckets[bucket];

        while (current != null) {
            int order = Integer.compareUnsigned(current.fingerprint, fingerprint);
            if (order < 0) {
                break;
            }
            if (order == 0 && arena.contentEquals(current.handle.offset(), bytes)) {
                return new Lookup(current.handle, true);
            }
            previous = current;
            current = current.next;
        }

        var handle = arena.allocate(bytes.length + 1);
        arena.write(handle.offset(), bytes);
        arena.put(handle.offset() + bytes.length, (byte) 0);

        var entry = new Entry(fingerprint, handle, current);
        if (previous == null) {
            buckets[bucket] = entry;
        } else {
            previous.next = entry;
        }
        size++;
        return new Lookup(handle, false);
    }

    /**
     * Find the handle of a stored value equal to {@code bytes} without inserting.
     *
     * @return the handle, or null if the value is not stored
     */
    public UniqueStringHandle find(int fingerprint, byte[] bytes) {
        assertOpen();
        for (Entry e = buckets[bucketIndex(fingerprint)]; e != null; e = e.next) {
            int order = Integer.compareUnsigned(e.fingerprint, fingerprint);
            if (order < 0) {
                return null;
            }
            if (order == 0 && arena.contentEquals(e.handle.offset(), bytes)) {
                return e.handle;
            }
        }
        return null;
    }

    /**
     * Number of entries in the table.
     */
    public int size() {
        return size;
    }

    public boolean isReleased() {
        return buckets == null;
    }

    /**
     * Unlink every entry and drop the bucket array.
     * <p>
     * Chains are walked iteratively, so the depth of a chain never reaches the call stack.
     * Handles already given out are not affected.
     *
     * @return number of entries released
     */
    public int release() {
        if (buckets == null) {
            return 0;
        }
        int released = 0;
        for (int i = 0; i < BUCKET_COUNT; i++) {
            Entry e = buckets[i];
            buckets[i] = null;
            while (e != null) {
                Entry next = e.next;
                e.next = null;
                e = next;
                released++;
            }
        }
        buckets = null;
        size = 0;
        return released;
    }

    /**
     * Fingerprints of one bucket's chain, head first.
     */
    int[] chainFingerprints(int bucket) {
        assertOpen();
        int length = 0;
        for (Entry e = buckets[bucket]; e != null; e = e.next) {
            length++;
        }
        int[] fingerprints = new int[length];
        int i = 0;
        for (Entry e = buckets[bucket]; e != null; e = e.next) {
            fingerprints[i++] = e.fingerprint;
        }
        return fingerprints;
    }

    static int bucketIndex(int fingerprint) {
        return Integer.remainderUnsigned(fingerprint, BUCKET_COUNT);
    }

    private void assertOpen() {
        if (buckets == null) {
            throw new IllegalStateException("Entry table has been released");
        }
    }

    /**
     * Outcome of {@link #findOrInsert(int, byte[])}.
     *
     * @param handle  handle of the stored value
     * @param existed true if the value was already stored
     */
    public record Lookup(UniqueStringHandle handle, boolean existed) {}

    private static final class Entry {
        private final int fingerprint;
        private final UniqueStringHandle handle;
        private Entry next;

        private Entry(int fingerprint, UniqueStringHandle handle, Entry next) {
            this.fingerprint = fingerprint;
            this.handle = handle;
            this.next = next;
        }
    }
}
