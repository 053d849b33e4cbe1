// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.internal;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Single-writer guard for registry state.
 *
 * <p>Writes are exclusive and non-reentrant: a thread that is already inside a write
 * (for example a collaborator calling back into the registry during discovery) is
 * rejected instead of observing half-built state. Reads share the lock and are allowed
 * from inside a write on the same thread.
 */
public final class WriteGuard {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final String owner;

    public WriteGuard(final String owner) {
        this.owner = owner;
    }

    /**
     * Runs {@code action} holding the write lock.
     *
     * @throws IllegalStateException if the current thread is already writing
     */
    public <T> T write(final Supplier<T> action) {
        if (lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("reentrant write into " + owner + " rejected");
        }
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Runs {@code action} holding the read lock.
     */
    public <T> T read(final Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
