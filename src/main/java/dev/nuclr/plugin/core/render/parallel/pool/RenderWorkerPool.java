package dev.nuclr.plugin.core.render.parallel.pool;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Long-lived render threads shared across batches.
 *
 * <p>The pool grows on demand and never shrinks. Each worker owns a
 * {@link BitmapPool} for its whole life and clears it itself: when asked to
 * by {@link #signalClearCaches()}, and as the last thing it does before
 * exiting.
 *
 * <p>Workers stop cooperatively. {@link #shutdown()} raises the stop flag;
 * each worker finishes once the queue is empty and no job is outstanding.
 */
@Slf4j
public final class RenderWorkerPool {

    private final String threadNamePrefix;
    private final int bitmapPoolSize;
    private final BitmapAllocator allocator;

    private final RenderQueue queue = new RenderQueue();
    private final BackpressureGovernor governor = new BackpressureGovernor();

    /** Guards growth of {@link #workers}. */
    private final ReentrantLock workersLock = new ReentrantLock();
    private final List<Thread> workers = new ArrayList<>();
    private int nextWorkerId = 1;

    /** Guards idle waits, enqueue visibility and the stop transition. */
    private final ReentrantLock idleLock = new ReentrantLock();
    private final Condition wake = idleLock.newCondition();

    private final AtomicBoolean stop = new AtomicBoolean();
    private final AtomicLong clearGeneration = new AtomicLong();

    public RenderWorkerPool(String threadNamePrefix, int bitmapPoolSize) {
        this(threadNamePrefix, bitmapPoolSize, BitmapAllocator.DEFAULT);
    }

    public RenderWorkerPool(String threadNamePrefix, int bitmapPoolSize, BitmapAllocator allocator) {
        this.threadNamePrefix = threadNamePrefix;
        this.bitmapPoolSize   = bitmapPoolSize;
        this.allocator        = allocator;
    }

    // ------------------------------------------------------------ sizing

    /** Start workers until at least {@code desired} are alive. Terminated workers are replaced. */
    public void ensureWorkerCount(int desired) {
        workersLock.lock();
        try {
            if (stop.get()) throw new IllegalStateException("Render pool is shut down");
            if (workers.removeIf(t -> t.getState() == Thread.State.TERMINATED)) {
                log.warn("Replacing terminated render workers");
            }
            int current = workers.size();
            if (desired <= current) return;
            for (int i = current; i < desired; i++) {
                Thread t = new Thread(this::runWorker, threadNamePrefix + nextWorkerId++);
                t.setDaemon(true);
                workers.add(t);
                t.start();
            }
            log.info("Render pool grown from {} to {} workers", current, desired);
        } finally {
            workersLock.unlock();
        }
    }

    /** Workers started and not yet terminated. */
    public int workerCount() {
        workersLock.lock();
        try {
            return (int) workers.stream().filter(t -> t.getState() != Thread.State.TERMINATED).count();
        } finally {
            workersLock.unlock();
        }
    }

    /** Ceiling on outstanding jobs; 0 disables backpressure. */
    public void setMaxQueueDepth(int depth) {
        governor.setMaxOutstanding(depth);
    }

    public int maxQueueDepth() {
        return governor.maxOutstanding();
    }

    /** Jobs enqueued whose callback has not yet returned. */
    public int outstanding() {
        return governor.outstanding();
    }

    // ----------------------------------------------------------- submission

    /** Enqueue one job, blocking while the queue depth ceiling is reached. */
    public void enqueue(RenderJob job) {
        governor.acquire(1);
        publish(() -> queue.enqueue(job), 1, false);
    }

    /** Enqueue a whole batch at once; see {@link BackpressureGovernor} for the oversized-batch rule. */
    public void enqueueAll(List<RenderJob> jobs) {
        if (jobs.isEmpty()) return;
        governor.acquire(jobs.size());
        publish(() -> queue.enqueueAll(jobs), jobs.size(), true);
    }

    private void publish(Runnable add, int count, boolean wakeAll) {
        idleLock.lock();
        try {
            if (stop.get()) {
                governor.release(count);
                throw new RejectedExecutionException("Render pool is shut down");
            }
            add.run();
            if (wakeAll) wake.signalAll();
            else wake.signal();
        } finally {
            idleLock.unlock();
        }
    }

    /** Block until every enqueued job has completed. */
    public void awaitCompletion() {
        governor.awaitDrained();
    }

    /** Ask idle workers to clear their bitmap pools; the pool itself stays up. */
    public void signalClearCaches() {
        idleLock.lock();
        try {
            clearGeneration.incrementAndGet();
            wake.signalAll();
        } finally {
            idleLock.unlock();
        }
    }

    // ------------------------------------------------------------- shutdown

    /** Stop all workers and wait for them to exit. Idempotent. */
    public void shutdown() {
        idleLock.lock();
        try {
            if (stop.getAndSet(true)) return;
            wake.signalAll();
        } finally {
            idleLock.unlock();
        }

        List<Thread> toJoin;
        workersLock.lock();
        try {
            toJoin = new ArrayList<>(workers);
        } finally {
            workersLock.unlock();
        }

        boolean interrupted = false;
        for (Thread t : toJoin) {
            while (t.isAlive()) {
                try {
                    t.join();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
        log.info("Render pool shut down ({} workers)", toJoin.size());
    }

    public boolean isShutdown() {
        return stop.get();
    }

    // --------------------------------------------------------------- worker

    private void runWorker() {
        BitmapPool bitmaps = new BitmapPool(bitmapPoolSize, allocator);
        long seenClear = clearGeneration.get();

        while (true) {
            RenderJob job = queue.poll();
            if (job != null) {
                try {
                    PageRenderStep.execute(job, bitmaps);
                } catch (Throwable t) {
                    log.error("Render job for page {} failed", job.pageIndex(), t);
                } finally {
                    governor.complete();
                }
                continue;
            }

            idleLock.lock();
            try {
                while (!stop.get() && clearGeneration.get() == seenClear && queue.isEmpty()) {
                    wake.awaitUninterruptibly();
                }
            } finally {
                idleLock.unlock();
            }

            long generation = clearGeneration.get();
            if (generation != seenClear) {
                seenClear = generation;
                bitmaps.clear();
            }

            if (stop.get() && queue.isEmpty()) {
                governor.awaitDrained();
                bitmaps.clear();
                log.debug("{} exiting", Thread.currentThread().getName());
                return;
            }
        }
    }
}
