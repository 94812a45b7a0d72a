package io.unistr.storage;

import io.unistr.core.ArenaExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Contiguous, append-only byte block holding terminated string values.
 * <p>
 * Bytes {@code [0, used)} are committed. Capacity only grows, in whole multiples
 * of {@link #GROWTH_QUANTUM} (capped at the largest allocatable array), until
 * {@link #compact()} trims it to {@code used}.
 * Growth copies the block into a larger array, so absolute positions move while
 * offsets stay put. Callers hold {@link UniqueStringHandle}s (offsets) and call
 * {@link #resolve(int)} whenever they need the bytes.
 * <p>
 * <b>Thread-safety:</b> none. Mutation must be confined to one thread or guarded
 * externally; a compacted arena that is no longer mutated may be read concurrently.
 */
public final class StringArena {

    public static final int GROWTH_QUANTUM = 1024;

    /**
     * Largest array length the JVM reliably hands out.
     */
    static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private static final Logger LOG = LoggerFactory.getLogger(StringArena.class);
    private static final byte[] EMPTY = new byte[0];

    private final int maxCapacity;
    private byte[] data;
    private int used;
    private int growthCount;
    private boolean released;

    public StringArena() {
        this(0);
    }

    /**
     * Create an arena.
     *
     * @param initialCapacity bytes to reserve up front (zero or more)
     */
    public StringArena(int initialCapacity) {
        this(initialCapacity, MAX_CAPACITY);
    }

    StringArena(int initialCapacity, int maxCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must not be negative: " + initialCapacity);
        }
        if (initialCapacity > maxCapacity) {
            throw new ArenaExhaustedException(initialCapacity, maxCapacity);
        }
        this.maxCapacity = maxCapacity;
        this.data = initialCapacity == 0 ? EMPTY : new byte[initialCapacity];
    }

    /**
     * Reserve {@code size} bytes at the end of the committed range.
     * <p>
     * The caller is expected to fill the range through {@link #write(int, byte[])}.
     *
     * @param size number of bytes to reserve
     * @return handle to the first reserved byte
     * @throws ArenaExhaustedException if the arena cannot grow that far
     */
    public UniqueStringHandle allocate(int size) {
        assertLive();
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        long needed = (long) used + size;
        if (needed > data.length) {
            grow(needed, size);
        }
        var handle = new UniqueStringHandle(used, this);
        used += size;
        return handle;
    }

    private void grow(long needed, int size) {
        if (needed > maxCapacity) {
            throw new ArenaExhaustedException(needed, maxCapacity);
        }
        long newCapacity = Math.min(
                (long) data.length + (long) GROWTH_QUANTUM * (size / GROWTH_QUANTUM + 1),
                maxCapacity);
        int oldCapacity = data.length;
        data = Arrays.copyOf(data, (int) newCapacity);
        growthCount++;
        if (LOG.isDebugEnabled()) {
            LOG.debug("Arena grew from {} to {} bytes ({} used)", oldCapacity, newCapacity, used);
        }
    }

    /**
     * Copy {@code bytes} into an already allocated range.
     *
     * @param offset start of the range, as returned by {@link #allocate(int)}
     * @param bytes  content to copy
     */
    public void write(int offset, byte[] bytes) {
        assertLive();
        if (offset < 0 || offset > used - bytes.length) {
            throw new IndexOutOfBoundsException(
                    "write of " + bytes.length + " bytes at " + offset + " exceeds committed range " + used);
        }
        System.arraycopy(bytes, 0, data, offset, bytes.length);
    }

    /**
     * Write a single byte inside the committed range.
     */
    public void put(int offset, byte value) {
        assertLive();
        checkCommitted(offset);
        data[offset] = value;
    }

    /**
     * Shrink capacity to exactly the committed size. Offsets are unaffected.
     */
    public void compact() {
        assertLive();
        if (data.length == used) {
            return;
        }
        data = used == 0 ? EMPTY : Arrays.copyOf(data, used);
    }

    /**
     * Drop the block and reset the arena. Every handle into it becomes invalid.
     */
    public void clear() {
        data = EMPTY;
        used = 0;
        released = true;
    }

    /**
     * Current address of the byte at {@code offset}.
     * <p>
     * The result reflects the block as it is now; a later allocation may move the
     * content to a new block.
     *
     * @param offset committed offset
     * @return live address
     */
    public ArenaAddress resolve(int offset) {
        assertLive();
        checkCommitted(offset);
        return new ArenaAddress(data, offset);
    }

    /**
     * Whether {@code address} points into the committed range of the current block.
     */
    public boolean contains(ArenaAddress address) {
        return !released
                && address.isIn(data)
                && address.offset() >= 0
                && address.offset() < used;
    }

    /**
     * Compare the terminated value stored at {@code offset} with {@code bytes}.
     *
     * @return true if the stored value is exactly {@code bytes} followed by the terminator
     */
    public boolean contentEquals(int offset, byte[] bytes) {
        assertLive();
        checkCommitted(offset);
        int end = offset + bytes.length;
        if (end >= used) {
            return false;
        }
        return data[end] == 0 && Arrays.equals(data, offset, end, bytes, 0, bytes.length);
    }

    /**
     * Number of committed bytes.
     */
    public int used() {
        return used;
    }

    /**
     * Number of reserved bytes, committed or not.
     */
    public int capacity() {
        return data.length;
    }

    /**
     * Number of times the block has been enlarged.
     */
    public int growthCount() {
        return growthCount;
    }

    public boolean isReleased() {
        return released;
    }

    private void checkCommitted(int offset) {
        if (offset < 0 || offset >= used) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside committed range [0, " + used + ")");
        }
    }

    private void assertLive() {
        if (released) {
            throw new IllegalStateException("Arena has been released");
        }
    }
}
