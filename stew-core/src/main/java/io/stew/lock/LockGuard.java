package io.stew.lock;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped hold on a {@link ReferenceCountedLock}, for use with try-with-resources.
 * <pre>
 * try (LockGuard guard = LockGuard.acquire(lock)) {
 *     // read while held
 * }
 * </pre>
 * Closing releases the hold once; further closes are ignored.
 */
public final class LockGuard implements AutoCloseable {

    private final ReferenceCountedLock lock;
    private final AtomicBoolean released = new AtomicBoolean();

    private LockGuard(ReferenceCountedLock lock) {
        this.lock = lock;
    }

    public static LockGuard acquire(ReferenceCountedLock lock) {
        lock.lock();
        return new LockGuard(lock);
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            lock.unlock();
        }
    }
}
