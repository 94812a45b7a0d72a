package io.unistr.core;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable configuration for a unique-string store.
 * <p>
 * Use the builder to override the defaults:
 * <pre>
 * UniqueStringsConfiguration config = UniqueStringsConfiguration.builder()
 *     .initialCapacity(64 * 1024)
 *     .build();
 * </pre>
 * <p>
 * The bucket count and the fingerprint seed are process-wide constants and
 * cannot be set here.
 */
public final class UniqueStringsConfiguration {

    private static final UniqueStringsConfiguration DEFAULTS = builder().build();

    private final int initialCapacity;
    private final Charset charset;

    private UniqueStringsConfiguration(Builder builder) {
        this.initialCapacity = builder.initialCapacity;
        this.charset = builder.charset;
    }

    /**
     * Create a new builder for UniqueStringsConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The default configuration: empty arena, UTF-8 text.
     */
    public static UniqueStringsConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Get the number of bytes reserved when the arena is created.
     *
     * @return initial arena capacity in bytes
     */
    public int initialCapacity() {
        return initialCapacity;
    }

    /**
     * Get the charset used to encode and decode text values.
     *
     * @return the text charset
     */
    public Charset charset() {
        return charset;
    }

    @Override
    public String toString() {
        return "UniqueStringsConfiguration{initialCapacity=" + initialCapacity + ", charset=" + charset + '}';
    }

    /**
     * Builder for UniqueStringsConfiguration.
     */
    public static class Builder {
        private static final byte[] ASCII_A = {'A'};

        private int initialCapacity = 0;
        private Charset charset = StandardCharsets.UTF_8;

        private Builder() {
        }

        /**
         * Set the number of bytes to reserve up front.
         *
         * @param initialCapacity initial capacity in bytes (zero or more)
         * @return this builder for method chaining
         */
        public Builder initialCapacity(int initialCapacity) {
            this.initialCapacity = initialCapacity;
            return this;
        }

        /**
         * Set the charset used by the text-based operations. Stored values end in a
         * zero byte, so only ASCII-compatible charsets are accepted.
         *
         * @param charset the charset (default: UTF-8)
         * @return this builder for method chaining
         */
        public Builder charset(Charset charset) {
            this.charset = charset;
            return this;
        }

        /**
         * Build the immutable configuration.
         *
         * @return a new UniqueStringsConfiguration instance
         */
        public UniqueStringsConfiguration build() {
            if (initialCapacity < 0) {
                throw new IllegalArgumentException("initialCapacity must not be negative: " + initialCapacity);
            }
            Objects.requireNonNull(charset, "charset");
            if (!Arrays.equals("A".getBytes(charset), ASCII_A)) {
                throw new IllegalArgumentException("charset must be ASCII-compatible: " + charset);
            }
            return new UniqueStringsConfiguration(this);
        }
    }
}
