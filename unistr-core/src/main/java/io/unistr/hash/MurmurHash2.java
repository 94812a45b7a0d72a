package io.unistr.hash;

/**
 * 32-bit MurmurHash2 over byte ranges.
 * <p>
 * Words are composed little-endian from individual bytes, so a given input
 * produces the same value on every platform.
 */
public final class MurmurHash2 {

    /**
     * Seed shared by every store in the process.
     */
    public static final int FINGERPRINT_SEED = 0xf9a025a4;

    private static final int M = 0x5bd1e995;
    private static final int R = 24;

    private MurmurHash2() {
    }

    /**
     * Fingerprint a whole array with {@link #FINGERPRINT_SEED}.
     */
    public static int fingerprint(byte[] data) {
        return hash(data, 0, data.length, FINGERPRINT_SEED);
    }

    /**
     * Hash {@code length} bytes of {@code data} starting at {@code offset}.
     *
     * @param data   source bytes
     * @param offset first byte to hash
     * @param length number of bytes to hash
     * @param seed   hash seed
     * @return the 32-bit hash, to be treated as unsigned
     */
    public static int hash(byte[] data, int offset, int length, int seed) {
        if (offset < 0 || length < 0 || offset > data.length - length) {
            throw new IndexOutOfBoundsException(
                    "range [" + offset + ", " + offset + " + " + length + ") out of bounds for " + data.length);
        }
        int h = seed ^ length;
        int pos = offset;
        int remaining = length;

        while (remaining >= 4) {
            int k = (data[pos] & 0xff)
                    | (data[pos + 1] & 0xff) << 8
                    | (data[pos + 2] & 0xff) << 16
                    | (data[pos + 3] & 0xff) << 24;

            k *= M;
            k ^= k >>> R;
            k *= M;

            h *= M;
            h ^= k;

            pos += 4;
            remaining -= 4;
        }

        switch (remaining) {
            case 3:
                h ^= (data[pos + 2] & 0xff) << 16;
                // fall through
            case 2:
                h ^= (data[pos + 1] & 0xff) << 8;
                // fall through
            case 1:
                h ^= data[pos] & 0xff;
                // fall through
            default:
                h *= M;
        }

        h ^= h >>> 13;
        h *= M;
        h ^= h >>> 15;

        return h;
    }
}
