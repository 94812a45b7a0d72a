package io.unistr.storage;

import java.nio.charset.Charset;
import java.util.Arrays;

/**
 * A resolved position inside an arena block: the block as it was at resolution
 * time plus an offset into it.
 * <p>
 * Addresses are short-lived and read-only. After the arena grows or is compacted
 * the address still reads the old bytes but no longer belongs to the arena
 * (see {@link StringArena#contains(ArenaAddress)}).
 */
public final class ArenaAddress {

    private final byte[] block;
    private final int offset;

    ArenaAddress(byte[] block, int offset) {
        this.block = block;
        this.offset = offset;
    }

    /**
     * Position of the first byte within its block.
     */
    public int offset() {
        return offset;
    }

    /**
     * Address {@code delta} bytes further along the same block.
     */
    public ArenaAddress shift(int delta) {
        return new ArenaAddress(block, offset + delta);
    }

    /**
     * Byte {@code index} positions after this address.
     */
    public byte byteAt(int index) {
        int position = offset + index;
        if (index < 0 || position >= block.length) {
            throw new IndexOutOfBoundsException("index " + index + " outside block from offset " + offset);
        }
        return block[position];
    }

    /**
     * Number of bytes before the terminator (or the end of the block).
     */
    public int length() {
        int end = offset;
        while (end < block.length && block[end] != 0) {
            end++;
        }
        return end - offset;
    }

    /**
     * Copy of the terminated value, without the terminator.
     */
    public byte[] toBytes() {
        return Arrays.copyOfRange(block, offset, offset + length());
    }

    /**
     * Decode the terminated value with {@code charset}.
     */
    public String decode(Charset charset) {
        return new String(block, offset, length(), charset);
    }

    /**
     * Whether both addresses point into the same block.
     */
    boolean sharesBlockWith(ArenaAddress other) {
        return block == other.block;
    }

    boolean isIn(byte[] candidate) {
        return block == candidate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ArenaAddress)) {
            return false;
        }
        ArenaAddress other = (ArenaAddress) o;
        return block == other.block && offset == other.offset;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(block) + offset;
    }

    @Override
    public String toString() {
        return "ArenaAddress[offset=" + offset + ", blockSize=" + block.length + "]";
    }
}
