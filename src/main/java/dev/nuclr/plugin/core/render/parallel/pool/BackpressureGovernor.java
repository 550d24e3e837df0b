package dev.nuclr.plugin.core.render.parallel.pool;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks outstanding jobs (enqueued, callback not yet returned) and blocks
 * producers while the configured ceiling is reached.
 *
 * <p>The outstanding count is the only completion signal of the pool: it is
 * raised before a job becomes visible to workers and lowered after its
 * callback has returned.
 *
 * <p>A bulk acquisition larger than the ceiling waits for
 * {@code min(n, ceiling)} free slots and then takes all {@code n}, so the
 * count may exceed the ceiling by the size of that one submission.
 */
final class BackpressureGovernor {

    private final AtomicInteger outstanding    = new AtomicInteger();
    private final AtomicInteger maxOutstanding = new AtomicInteger();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition capacity = lock.newCondition();
    private final Condition drained  = lock.newCondition();

    /** 0 disables backpressure. */
    void setMaxOutstanding(int max) {
        maxOutstanding.set(Math.max(0, max));
        lock.lock();
        try {
            capacity.signalAll();
        } finally {
            lock.unlock();
        }
    }

    int maxOutstanding() {
        return maxOutstanding.get();
    }

    int outstanding() {
        return outstanding.get();
    }

    /** Wait for room for {@code n} jobs, then count them as outstanding. */
    void acquire(int n) {
        if (n <= 0) return;
        lock.lock();
        try {
            while (true) {
                int max = maxOutstanding.get();
                if (max <= 0) break;
                int required = Math.min(n, max);
                if (outstanding.get() <= max - required) break;
                capacity.awaitUninterruptibly();
            }
            outstanding.addAndGet(n);
        } finally {
            lock.unlock();
        }
    }

    /** Mark one job finished. */
    void complete() {
        release(1);
    }

    /** Mark {@code n} jobs finished, or roll back an acquisition that was never enqueued. */
    void release(int n) {
        lock.lock();
        try {
            int remaining = outstanding.addAndGet(-n);
            if (remaining < 0) {
                outstanding.addAndGet(n);
                throw new IllegalStateException("Outstanding job count would become " + remaining);
            }
            capacity.signalAll();
            if (remaining == 0) {
                drained.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /** Block until no job is outstanding. */
    void awaitDrained() {
        lock.lock();
        try {
            while (outstanding.get() > 0) {
                drained.awaitUninterruptibly();
            }
        } finally {
            lock.unlock();
        }
    }
}
