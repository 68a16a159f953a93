package io.stew.lock;

/**
 * Lifecycle hooks fired by a {@link ReferenceCountedLock} on hold-count transitions.
 * <p>
 * Both hooks run under the lock's transition mutex: they never overlap each other or
 * any action passed to {@link ReferenceCountedLock#exclusive(java.util.function.Supplier)}.
 */
public interface LockObserver {

    /**
     * Called once when the hold count goes from 0 to 1, before the first locker returns.
     * If this throws, the lock is not taken.
     */
    void onFirstAcquire();

    /**
     * Called once when the hold count goes from 1 to 0, before the last unlocker returns.
     */
    void onLastRelease();
}
