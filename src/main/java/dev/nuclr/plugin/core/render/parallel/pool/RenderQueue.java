package dev.nuclr.plugin.core.render.parallel.pool;

import java.util.Collection;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Lock-free multi-producer, multi-consumer job queue with one sub-queue per
 * {@link JobKind}. Pooled jobs are always taken before owned ones. No order
 * is promised between jobs beyond each being dequeued exactly once.
 *
 * <p>{@link #isEmpty()} is a hint for idle workers only; completion is
 * tracked by {@link BackpressureGovernor}.
 */
final class RenderQueue {

    private final Queue<RenderJob> pooled = new ConcurrentLinkedQueue<>();
    private final Queue<RenderJob> owned  = new ConcurrentLinkedQueue<>();

    void enqueue(RenderJob job) {
        queueFor(job).add(job);
    }

    void enqueueAll(Collection<RenderJob> jobs) {
        for (RenderJob job : jobs) {
            enqueue(job);
        }
    }

    /** Next job, pooled variant first, or null if both sub-queues are empty. */
    RenderJob poll() {
        RenderJob job = pooled.poll();
        return job != null ? job : owned.poll();
    }

    boolean isEmpty() {
        return pooled.isEmpty() && owned.isEmpty();
    }

    private Queue<RenderJob> queueFor(RenderJob job) {
        return job.kind() == JobKind.POOLED ? pooled : owned;
    }
}
