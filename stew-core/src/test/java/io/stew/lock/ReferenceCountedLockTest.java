package io.stew.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceCountedLockTest {

    static class CountingObserver implements LockObserver {
        final AtomicInteger acquires = new AtomicInteger();
        final AtomicInteger releases = new AtomicInteger();
        final AtomicInteger active = new AtomicInteger();

        @Override
        public void onFirstAcquire() {
            acquires.incrementAndGet();
            active.incrementAndGet();
        }

        @Override
        public void onLastRelease() {
            releases.incrementAndGet();
            active.decrementAndGet();
        }
    }

    @Test
    @DisplayName("hooks should fire once per 0 -> N -> 0 cohort")
    void hooks_shouldFireOncePerCohort() {
        var observer = new CountingObserver();
        var lock = new ReferenceCountedLock(observer);

        lock.lock();
        lock.lock();
        lock.lock();
        assertThat(lock.holdCount()).isEqualTo(3);
        assertThat(observer.acquires).hasValue(1);

        lock.unlock();
        lock.unlock();
        assertThat(observer.releases).hasValue(0);
        assertThat(lock.isLocked()).isTrue();

        lock.unlock();
        assertThat(observer.releases).hasValue(1);
        assertThat(lock.isLocked()).isFalse();

        lock.lock();
        lock.unlock();
        assertThat(observer.acquires).hasValue(2);
        assertThat(observer.releases).hasValue(2);
    }

    @Test
    @DisplayName("unlock without a hold should violate the lock contract")
    void unlock_withoutHold_shouldThrow() {
        var observer = new CountingObserver();
        var lock = new ReferenceCountedLock(observer);

        assertThatThrownBy(lock::unlock)
                .isInstanceOf(LockContractException.class)
                .hasMessageContaining("without a matching lock()");
        assertThat(observer.releases).hasValue(0);
    }

    @Test
    @DisplayName("a failing acquire hook should leave the lock unheld")
    void failingAcquireHook_shouldNotTakeHold() {
        var lock = new ReferenceCountedLock(new LockObserver() {
            @Override
            public void onFirstAcquire() {
                throw new IllegalStateException("boom");
            }

            @Override
            public void onLastRelease() {
            }
        });

        assertThatThrownBy(lock::lock).isInstanceOf(IllegalStateException.class).hasMessage("boom");
        assertThat(lock.holdCount()).isZero();
    }

    @Test
    @DisplayName("failing release hook should still release the hold and re-fire acquire on next lock")
    void failingReleaseHook_shouldReleaseHold() {
        var failRelease = new AtomicInteger(1);
        var observer = new CountingObserver() {
            @Override
            public void onLastRelease() {
                super.onLastRelease();
                if (failRelease.getAndDecrement() > 0) {
                    throw new IllegalStateException("release failed");
                }
            }
        };
        var lock = new ReferenceCountedLock(observer);
        lock.lock();

        assertThatThrownBy(lock::unlock).isInstanceOf(IllegalStateException.class).hasMessage("release failed");
        assertThat(lock.holdCount()).isZero();
        assertThat(lock.isLocked()).isFalse();

        lock.lock();
        assertThat(observer.acquires).hasValue(2);
        lock.unlock();
        assertThat(observer.releases).hasValue(2);
    }

    @Test
    @DisplayName("tryLock should take a hold when the mutex is free")
    void tryLock_shouldTakeHold() {
        var observer = new CountingObserver();
        var lock = new ReferenceCountedLock(observer);

        assertThat(lock.tryLock()).isTrue();
        assertThat(observer.acquires).hasValue(1);
        lock.unlock();
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("tryLock should fail while an exclusive action runs on another thread")
    void tryLock_shouldFailDuringExclusiveAction() throws Exception {
        var lock = new ReferenceCountedLock(new CountingObserver());
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var executor = Executors.newSingleThreadExecutor();
        try {
            var writer = executor.submit(() -> lock.runExclusive(() -> {
                entered.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            entered.await();

            assertThat(lock.tryLock()).isFalse();

            release.countDown();
            writer.get(5, TimeUnit.SECONDS);
            assertThat(lock.tryLock()).isTrue();
            lock.unlock();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("exclusive should return the action result")
    void exclusive_shouldReturnResult() {
        var lock = new ReferenceCountedLock(new CountingObserver());

        assertThat(lock.exclusive(() -> 42)).isEqualTo(42);
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    @DisplayName("concurrent holders should never observe overlapping hooks")
    void concurrentHolders_shouldSerializeHooks() throws Exception {
        var overlap = new AtomicReference<String>();
        var observer = new CountingObserver() {
            @Override
            public void onFirstAcquire() {
                if (active.get() != 0) {
                    overlap.compareAndSet(null, "acquire while active");
                }
                super.onFirstAcquire();
            }

            @Override
            public void onLastRelease() {
                if (active.get() != 1) {
                    overlap.compareAndSet(null, "release while inactive");
                }
                super.onLastRelease();
            }
        };
        var lock = new ReferenceCountedLock(observer);
        int threadCount = 8;
        int rounds = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        var barrier = new CyclicBarrier(threadCount);
        var done = new CountDownLatch(threadCount);

        for (int t = 0; t < threadCount; t++) {
            executor.submit(() -> {
                try {
                    barrier.await();
                    for (int i = 0; i < rounds; i++) {
                        lock.lock();
                        lock.unlock();
                    }
                } catch (Exception e) {
                    overlap.compareAndSet(null, e.toString());
                } finally {
                    done.countDown();
                }
            });
        }

        assertThat(done.await(20, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(overlap.get()).isNull();
        assertThat(lock.holdCount()).isZero();
        assertThat(observer.acquires.get()).isEqualTo(observer.releases.get());
        assertThat(observer.active).hasValue(0);
    }
}
