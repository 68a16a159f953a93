package io.stew.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Shared lock that counts its holders and notifies a {@link LockObserver} when the
 * count leaves and returns to zero.
 * <p>
 * Any number of threads may hold the lock at once; holding it only pins the observer's
 * state between the two hooks. Hold-count transitions and exclusive actions are
 * serialized by an internal mutex, which is held only for the duration of the
 * transition or action, never while the lock is held.
 * <p>
 * The lock is not owner-aware: any thread may release a hold taken by another.
 */
public final class ReferenceCountedLock {

    private static final Logger log = LoggerFactory.getLogger(ReferenceCountedLock.class);

    private final ReentrantLock transitionLock = new ReentrantLock();
    private final LockObserver observer;

    // Written under transitionLock only.
    private volatile int holdCount;

    public ReferenceCountedLock(LockObserver observer) {
        this.observer = Objects.requireNonNull(observer, "observer");
    }

    /**
     * Take a hold. The first hold fires {@link LockObserver#onFirstAcquire()}.
     */
    public void lock() {
        transitionLock.lock();
        try {
            acquireHold();
        } finally {
            transitionLock.unlock();
        }
    }

    /**
     * Take a hold unless a transition or exclusive action is running on another thread.
     *
     * @return true if the hold was taken
     */
    public boolean tryLock() {
        if (!transitionLock.tryLock()) {
            return false;
        }
        try {
            acquireHold();
            return true;
        } finally {
            transitionLock.unlock();
        }
    }

    /**
     * Release a hold. The last release fires {@link LockObserver#onLastRelease()}
     * and returns only after it completes. The hold is released even if the hook throws;
     * the next {@link #lock()} fires {@link LockObserver#onFirstAcquire()} again.
     *
     * @throws LockContractException if no hold is outstanding
     */
    public void unlock() {
        transitionLock.lock();
        try {
            var current = holdCount;
            if (current == 0) {
                throw new LockContractException("unlock() without a matching lock()");
            }
            holdCount = current - 1;
            if (current == 1) {
                log.trace("Last hold released on {}", observer);
                observer.onLastRelease();
            }
        } finally {
            transitionLock.unlock();
        }
    }

    /**
     * Run an action that must not overlap a hold-count transition.
     *
     * @param action the action
     * @param <R>    result type
     * @return the action's result
     */
    public <R> R exclusive(Supplier<R> action) {
        transitionLock.lock();
        try {
            return action.get();
        } finally {
            transitionLock.unlock();
        }
    }

    /**
     * Void variant of {@link #exclusive(Supplier)}.
     */
    public void runExclusive(Runnable action) {
        transitionLock.lock();
        try {
            action.run();
        } finally {
            transitionLock.unlock();
        }
    }

    /**
     * @return current number of holders (may be stale)
     */
    public int holdCount() {
        return holdCount;
    }

    public boolean isLocked() {
        return holdCount > 0;
    }

    private void acquireHold() {
        var current = holdCount;
        if (current == Integer.MAX_VALUE) {
            throw new LockContractException("hold count overflow");
        }
        if (current == 0) {
            log.trace("First hold acquired on {}", observer);
            observer.onFirstAcquire();
        }
        holdCount = current + 1;
    }

    @Override
    public String toString() {
        return "ReferenceCountedLock{holdCount=" + holdCount + "}";
    }
}
