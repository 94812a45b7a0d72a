package io.unistr.store;

import io.unistr.core.UniqueStringsConfiguration;
import io.unistr.storage.ArenaAddress;
import io.unistr.storage.UniqueStringHandle;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * {@link UniqueStringStore} that serializes writers of a shared store.
 * <p>
 * {@code add}, {@code freeze} and {@code destroy} take the write lock; every other
 * operation takes the read lock, so readers proceed in parallel between writes.
 * Addresses returned by {@link #address(UniqueStringHandle)} are only stable while
 * no other thread is adding; prefer {@link #resolve(UniqueStringHandle)}.
 */
public final class LockingUniqueStrings implements UniqueStringStore {

    private final UniqueStrings delegate;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public LockingUniqueStrings() {
        this(new UniqueStrings());
    }

    public LockingUniqueStrings(UniqueStringsConfiguration configuration) {
        this(new UniqueStrings(configuration));
    }

    public LockingUniqueStrings(UniqueStrings delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public UniqueStringHandle add(String text) {
        return write(() -> delegate.add(text));
    }

    @Override
    public UniqueStringHandle add(byte[] bytes) {
        return write(() -> delegate.add(bytes));
    }

    @Override
    public Optional<UniqueStringHandle> find(String text) {
        return read(() -> delegate.find(text));
    }

    @Override
    public String resolve(UniqueStringHandle handle) {
        return read(() -> delegate.resolve(handle));
    }

    @Override
    public byte[] resolveBytes(UniqueStringHandle handle) {
        return read(() -> delegate.resolveBytes(handle));
    }

    @Override
    public ArenaAddress address(UniqueStringHandle handle) {
        return read(() -> delegate.address(handle));
    }

    @Override
    public boolean owns(ArenaAddress address) {
        return read(() -> delegate.owns(address));
    }

    @Override
    public void freeze() {
        write(() -> {
            delegate.freeze();
            return null;
        });
    }

    @Override
    public void destroy() {
        write(() -> {
            delegate.destroy();
            return null;
        });
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public int size() {
        return read(delegate::size);
    }

    @Override
    public StoreState state() {
        return delegate.state();
    }

    @Override
    public UniqueStringsStats stats() {
        return read(delegate::stats);
    }

    private <T> T read(Supplier<T> action) {
        var readLock = lock.readLock();
        readLock.lock();
        try {
            return action.get();
        } finally {
            readLock.unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        var writeLock = lock.writeLock();
        writeLock.lock();
        try {
            return action.get();
        } finally {
            writeLock.unlock();
        }
    }
}
