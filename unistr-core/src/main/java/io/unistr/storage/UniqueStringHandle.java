package io.unistr.storage;

import java.util.Objects;

/**
 * Reference to a stored value: an offset into the owning arena.
 * <p>
 * The handle never caches an address, so it stays valid while the arena grows and
 * after it is compacted. It becomes invalid once the arena is cleared.
 *
 * @param offset position of the first byte in the owning arena
 * @param owner  arena the offset refers to
 */
public record UniqueStringHandle(int offset, StringArena owner) {

    public UniqueStringHandle {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        Objects.requireNonNull(owner, "owner");
    }

    /**
     * Resolve to the current address of the value.
     */
    public ArenaAddress address() {
        return owner.resolve(offset);
    }

    /**
     * Whether this handle was issued by {@code arena}.
     */
    public boolean belongsTo(StringArena arena) {
        return owner == arena;
    }

    @Override
    public String toString() {
        return "UniqueStringHandle[offset=" + offset + "]";
    }
}
