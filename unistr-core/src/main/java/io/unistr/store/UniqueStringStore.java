package io.unistr.store;

import io.unistr.core.StoreFrozenException;
import io.unistr.storage.ArenaAddress;
import io.unistr.storage.UniqueStringHandle;

import java.util.Optional;

/**
 * Deduplicating string store.
 * <p>
 * Each distinct value is stored once; callers keep {@link UniqueStringHandle}s and
 * resolve them when they need the text. A store is built with {@link #add(String)},
 * optionally frozen into a compact read-only form, and finally destroyed.
 *
 * @see UniqueStrings
 * @see LockingUniqueStrings
 */
public interface UniqueStringStore extends AutoCloseable {

    /**
     * Store {@code text} unless an equal value is already stored.
     *
     * @param text value without {@code '\0'} characters
     * @return handle to the single stored copy
     * @throws StoreFrozenException if the store has been frozen
     */
    UniqueStringHandle add(String text);

    /**
     * Store raw {@code bytes} unless an equal value is already stored.
     *
     * @param bytes value without zero bytes
     * @return handle to the single stored copy
     * @throws StoreFrozenException if the store has been frozen
     */
    UniqueStringHandle add(byte[] bytes);

    /**
     * Look up {@code text} without storing it.
     *
     * @throws StoreFrozenException if the store has been frozen
     */
    Optional<UniqueStringHandle> find(String text);

    /**
     * Decode the value behind {@code handle}.
     */
    String resolve(UniqueStringHandle handle);

    /**
     * Copy the raw bytes behind {@code handle}, without the terminator.
     */
    byte[] resolveBytes(UniqueStringHandle handle);

    /**
     * Current address of the value behind {@code handle}. Valid until the next {@code add}.
     */
    ArenaAddress address(UniqueStringHandle handle);

    /**
     * Whether {@code address} lies inside this store's committed content.
     */
    boolean owns(ArenaAddress address);

    /**
     * Discard the dedup index and compact storage. No values can be added afterwards.
     */
    void freeze();

    /**
     * Release all storage. Every handle issued by this store becomes invalid.
     */
    void destroy();

    /**
     * Number of distinct values stored.
     */
    int size();

    StoreState state();

    UniqueStringsStats stats();

    /**
     * Same as {@link #destroy()}.
     */
    @Override
    void close();
}
