package dev.nuclr.plugin.core.render.parallel;

import dev.nuclr.plugin.core.render.parallel.backend.RenderDocument;
import dev.nuclr.plugin.core.render.parallel.pool.BitmapAllocator;
import dev.nuclr.plugin.core.render.parallel.pool.BitmapPool;
import dev.nuclr.plugin.core.render.parallel.pool.JobKind;
import dev.nuclr.plugin.core.render.parallel.pool.PageHandleCollector;
import dev.nuclr.plugin.core.render.parallel.pool.PageRenderStep;
import dev.nuclr.plugin.core.render.parallel.pool.RenderJob;
import dev.nuclr.plugin.core.render.parallel.pool.RenderWorkerPool;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Renders ranges of pages of a {@link RenderDocument} on a shared pool of
 * render threads.
 *
 * <p>Created and owned by the host application, which must call
 * {@link #close()} before shutting down anything the render threads depend
 * on. The worker pool is created on the first parallel batch and reused by
 * later ones; after {@link #close()} the next batch starts a fresh pool.
 *
 * <p>A batch call returns once every page callback has returned and every
 * page loaded by the pool has been closed. It returns false only for an
 * invalid request, in which case nothing is rendered; failed pages are
 * reported through their own callback.
 */
@Slf4j
public class ParallelRenderer implements AutoCloseable {

    /** Queue depth ceiling applied to batches larger than this when none is given. */
    public static final int AUTO_QUEUE_DEPTH = 256;

    private static final String THREAD_NAME_PREFIX = "pdf-render-";

    private final ParallelRenderSettings settings;
    private final int hostParallelism;
    private final BitmapAllocator allocator;

    /** Batches hold the read lock; {@link #close()} takes the write lock. */
    private final ReentrantReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private final ReentrantLock poolLock = new ReentrantLock();
    private RenderWorkerPool pool;

    public ParallelRenderer() {
        this(ParallelRenderSettings.getInstance(), Runtime.getRuntime().availableProcessors());
    }

    public ParallelRenderer(ParallelRenderSettings settings, int hostParallelism) {
        this(settings, hostParallelism, BitmapAllocator.DEFAULT);
    }

    ParallelRenderer(ParallelRenderSettings settings, int hostParallelism, BitmapAllocator allocator) {
        this.settings        = settings;
        this.hostParallelism = hostParallelism;
        this.allocator       = allocator;
    }

    // ------------------------------------------------------------ public API

    /**
     * Render pages into freshly allocated bitmaps owned by the callback.
     * Pages are queued one at a time, each waiting for queue depth capacity.
     */
    public boolean renderPages(RenderDocument document, int startPage, int pageCount,
                               int width, int height, RenderOptions options,
                               PageCallback callback, Object userData) {
        return submit(JobKind.OWNED, document, startPage, pageCount, width, height, options, callback, userData);
    }

    /**
     * Render pages into bitmaps reused across pages; each bitmap is valid only
     * while its callback runs. With {@code width == height == 0} and
     * {@code options.dpi() > 0} every page is sized from its own dimensions.
     * Pages are queued in one bulk submission.
     */
    public boolean renderPagesPooled(RenderDocument document, int startPage, int pageCount,
                                     int width, int height, RenderOptions options,
                                     PageCallback callback, Object userData) {
        return submit(JobKind.POOLED, document, startPage, pageCount, width, height, options, callback, userData);
    }

    /**
     * Worker count chosen for {@code document} when the options leave it at 0.
     * The estimate is per document: a short range of a large document still
     * runs on the pool unless it is a single page.
     */
    public int recommendedWorkerCount(RenderDocument document) {
        return WorkerCountEstimator.forDocument(document, hostParallelism);
    }

    /** Current number of pool threads, 0 if no pool is running. */
    public int workerCount() {
        RenderWorkerPool p = currentPool();
        return p != null ? p.workerCount() : 0;
    }

    /** Pages queued or rendering whose callback has not yet returned. */
    public int outstandingPages() {
        RenderWorkerPool p = currentPool();
        return p != null ? p.outstanding() : 0;
    }

    /** Stop and join the render threads. Idempotent. */
    @Override
    public void close() {
        lifecycle.writeLock().lock();
        try {
            RenderWorkerPool toStop;
            poolLock.lock();
            try {
                toStop = pool;
                pool = null;
            } finally {
                poolLock.unlock();
            }
            if (toStop != null) {
                toStop.shutdown();
            }
        } finally {
            lifecycle.writeLock().unlock();
        }
    }

    // -------------------------------------------------------- batch handling

    private boolean submit(JobKind kind, RenderDocument document, int startPage, int pageCount,
                           int width, int height, RenderOptions options,
                           PageCallback callback, Object userData) {
        RenderOptions opts = options != null ? options : RenderOptions.fromSettings(settings);

        if (document == null || callback == null || pageCount <= 0) return false;
        boolean autoSize = kind == JobKind.POOLED && width == 0 && height == 0 && opts.dpi() > 0;
        if (!autoSize && (width <= 0 || height <= 0)) return false;

        int totalPages = document.pageCount();
        if (startPage < 0 || startPage >= totalPages) return false;
        int count = Math.min(pageCount, totalPages - startPage);

        int workers = opts.workerCount() > 0 ? opts.workerCount() : recommendedWorkerCount(document);

        if (workers == 1 || count == 1) {
            log.debug("Rendering {} pages of {} serially", count, document.name());
            renderSerially(buildJobs(kind, document, startPage, count, width, height, opts, callback, userData, null));
            return true;
        }

        lifecycle.readLock().lock();
        try {
            renderInPool(kind, document, startPage, count, width, height, opts, callback, userData, workers);
        } finally {
            lifecycle.readLock().unlock();
        }
        return true;
    }

    private void renderSerially(List<RenderJob> jobs) {
        BitmapPool bitmaps = new BitmapPool(settings.getBitmapPoolSize(), allocator);
        try {
            for (RenderJob job : jobs) {
                PageRenderStep.execute(job, bitmaps);
            }
        } finally {
            bitmaps.clear();
        }
    }

    private void renderInPool(JobKind kind, RenderDocument document, int startPage, int count,
                              int width, int height, RenderOptions opts,
                              PageCallback callback, Object userData, int workers) {
        PageHandleCollector collector = new PageHandleCollector();
        RenderWorkerPool workerPool = obtainPool(workers);

        int maxQueue = opts.maxQueueDepth() > 0
                ? opts.maxQueueDepth()
                : (count > AUTO_QUEUE_DEPTH ? AUTO_QUEUE_DEPTH : 0);
        workerPool.setMaxQueueDepth(maxQueue);

        log.debug("Rendering {} pages of {} on {} workers (queue depth {})",
                count, document.name(), workers, maxQueue);

        List<RenderJob> jobs = buildJobs(kind, document, startPage, count, width, height,
                opts, callback, userData, collector);
        try {
            if (kind == JobKind.POOLED) {
                workerPool.enqueueAll(jobs);
            } else {
                for (RenderJob job : jobs) {
                    workerPool.enqueue(job);
                }
            }
        } finally {
            workerPool.awaitCompletion();
            collector.closeAllUnderLock(document.lock());
        }

        if (!opts.keepWorkerCaches()) {
            workerPool.signalClearCaches();
        }
    }

    private static List<RenderJob> buildJobs(JobKind kind, RenderDocument document, int startPage, int count,
                                             int width, int height, RenderOptions opts,
                                             PageCallback callback, Object userData,
                                             PageHandleCollector collector) {
        List<RenderJob> jobs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            jobs.add(new RenderJob(kind, document, document.lock(), startPage + i,
                    width, height, opts.rotation(), opts.dpi(), opts.outputFormat(),
                    opts.formOverlay(), callback, userData, collector));
        }
        return jobs;
    }

    private RenderWorkerPool obtainPool(int workers) {
        poolLock.lock();
        try {
            if (pool == null) {
                pool = new RenderWorkerPool(THREAD_NAME_PREFIX, settings.getBitmapPoolSize(), allocator);
            }
            pool.ensureWorkerCount(workers);
            return pool;
        } finally {
            poolLock.unlock();
        }
    }

    private RenderWorkerPool currentPool() {
        poolLock.lock();
        try {
            return pool;
        } finally {
            poolLock.unlock();
        }
    }
}
