package io.unistr.store;

import io.unistr.core.StoreFrozenException;
import io.unistr.core.UniqueStringsConfiguration;
import io.unistr.hash.MurmurHash2;
import io.unistr.index.EntryTable;
import io.unistr.storage.ArenaAddress;
import io.unistr.storage.StringArena;
import io.unistr.storage.UniqueStringHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.util.Objects;
import java.util.Optional;

/**
 * Deduplicating string store backed by a single {@link StringArena}.
 * <p>
 * While {@link StoreState#BUILDING building}, every {@code add} hashes the value,
 * looks it up in an {@link EntryTable} and appends it to the arena only when it is
 * new. {@link #freeze()} drops the table and trims the arena, leaving a read-only
 * store whose handles still resolve.
 * <p>
 * <b>Thread-safety:</b>
 * <ul>
 *   <li>Building: not safe for concurrent use; confine to one thread or wrap in
 *       {@link LockingUniqueStrings}</li>
 *   <li>Frozen: safe for any number of concurrent readers</li>
 * </ul>
 */
public final class UniqueStrings implements UniqueStringStore {

    private static final Logger LOG = LoggerFactory.getLogger(UniqueStrings.class);

    private final Charset charset;
    private final StringArena arena;
    private EntryTable entries;
    private volatile StoreState state = StoreState.BUILDING;

    private int distinctStrings;
    private long addCalls;
    private long dedupHits;

    public UniqueStrings() {
        this(UniqueStringsConfiguration.defaults());
    }

    public UniqueStrings(UniqueStringsConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        this.charset = configuration.charset();
        this.arena = new StringArena(configuration.initialCapacity());
        this.entries = new EntryTable(arena);
    }

    /**
     * Create an empty store with the default configuration.
     */
    public static UniqueStrings create() {
        return new UniqueStrings();
    }

    @Override
    public UniqueStringHandle add(String text) {
        Objects.requireNonNull(text, "text");
        assertBuilding("add");
        return insert(encode(text));
    }

    @Override
    public UniqueStringHandle add(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        assertBuilding("add");
        checkNoTerminator(bytes);
        return insert(bytes);
    }

    private UniqueStringHandle insert(byte[] bytes) {
        var lookup = entries.findOrInsert(MurmurHash2.fingerprint(bytes), bytes);
        addCalls++;
        if (lookup.existed()) {
            dedupHits++;
        } else {
            distinctStrings++;
        }
        return lookup.handle();
    }

    @Override
    public Optional<UniqueStringHandle> find(String text) {
        Objects.requireNonNull(text, "text");
        assertBuilding("find");
        byte[] bytes = encode(text);
        return Optional.ofNullable(entries.find(MurmurHash2.fingerprint(bytes), bytes));
    }

    @Override
    public String resolve(UniqueStringHandle handle) {
        return address(handle).decode(charset);
    }

    @Override
    public byte[] resolveBytes(UniqueStringHandle handle) {
        return address(handle).toBytes();
    }

    @Override
    public ArenaAddress address(UniqueStringHandle handle) {
        Objects.requireNonNull(handle, "handle");
        assertNotDestroyed();
        if (!handle.belongsTo(arena)) {
            throw new IllegalArgumentException(handle + " was not issued by this store");
        }
        return handle.address();
    }

    @Override
    public boolean owns(ArenaAddress address) {
        Objects.requireNonNull(address, "address");
        return state != StoreState.DESTROYED && arena.contains(address);
    }

    @Override
    public void freeze() {
        var current = state;
        if (current == StoreState.FROZEN) {
            return;
        }
        assertNotDestroyed();
        int releasedEntries = entries.release();
        entries = null;
        int slack = arena.capacity() - arena.used();
        arena.compact();
        state = StoreState.FROZEN;
        LOG.debug("Froze store: {} entries released, {} bytes retained, {} slack bytes trimmed",
                releasedEntries, arena.used(), slack);
    }

    @Override
    public void destroy() {
        if (state == StoreState.DESTROYED) {
            return;
        }
        int releasedEntries = entries != null ? entries.release() : 0;
        entries = null;
        int releasedBytes = arena.capacity();
        arena.clear();
        distinctStrings = 0;
        state = StoreState.DESTROYED;
        LOG.debug("Destroyed store: {} entries and {} bytes released", releasedEntries, releasedBytes);
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public int size() {
        return distinctStrings;
    }

    @Override
    public StoreState state() {
        return state;
    }

    @Override
    public UniqueStringsStats stats() {
        return new UniqueStringsStats(
                state,
                distinctStrings,
                addCalls,
                dedupHits,
                arena.used(),
                arena.capacity(),
                arena.growthCount());
    }

    private byte[] encode(String text) {
        if (text.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("text must not contain NUL characters");
        }
        try {
            ByteBuffer encoded = charset.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(text));
            byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("text cannot be encoded as " + charset + ": " + e, e);
        }
    }

    private static void checkNoTerminator(byte[] bytes) {
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == 0) {
                throw new IllegalArgumentException("bytes must not contain a zero byte (index " + i + ")");
            }
        }
    }

    private void assertBuilding(String operation) {
        var current = state;
        if (current == StoreState.FROZEN) {
            throw new StoreFrozenException("Store is frozen; " + operation + " is not permitted");
        }
        if (current == StoreState.DESTROYED) {
            throw new IllegalStateException("Store is destroyed");
        }
    }

    private void assertNotDestroyed() {
        if (state == StoreState.DESTROYED) {
            throw new IllegalStateException("Store is destroyed");
        }
    }
}
