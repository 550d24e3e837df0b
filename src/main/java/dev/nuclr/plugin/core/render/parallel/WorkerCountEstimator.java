package dev.nuclr.plugin.core.render.parallel;

import dev.nuclr.plugin.core.render.parallel.backend.RenderDocument;

/**
 * Picks a worker count for a batch from its page count and how heavy each
 * page is, measured as encoded bytes per page.
 *
 * <p>The caps come from benchmark runs rather than a model. Light pages
 * (text, vectors) scale almost linearly; heavy pages (scans, photos) scale
 * best in the 150-300 page range; everything else stays moderate. The result
 * never exceeds the page count or the host parallelism.
 */
public final class WorkerCountEstimator {

    /** Below this many pages the pool costs more than it saves. */
    public static final int MIN_PARALLEL_UNITS = 4;

    static final long LIGHT_BYTES_PER_UNIT = 15_000;
    static final long HEAVY_BYTES_PER_UNIT = 100_000;

    private static final int MAX_DEFAULT_WORKERS = 16;
    private static final int UNKNOWN_HOST_WORKERS = 4;

    private WorkerCountEstimator() {}

    /**
     * @param unitCount       pages in the batch
     * @param bytesPerUnit    average encoded size of one page, 0 when unknown
     * @param hostParallelism hardware threads available
     */
    public static int estimate(int unitCount, long bytesPerUnit, int hostParallelism) {
        if (unitCount < MIN_PARALLEL_UNITS) {
            return 1;
        }
        int cap = bandCap(unitCount, bytesPerUnit);
        return Math.max(1, Math.min(unitCount, Math.min(cap, hostParallelism)));
    }

    /** Estimate for rendering every page of {@code document}. */
    public static int forDocument(RenderDocument document, int hostParallelism) {
        if (document == null) return 1;
        int pages = document.pageCount();
        long size = document.sizeBytes();
        long bytesPerUnit = (pages > 0 && size > 0) ? size / pages : 0;
        return estimate(pages, bytesPerUnit, hostParallelism);
    }

    /** Document-independent default: all hardware threads, at most 16. */
    public static int optimalWorkerCount(int hostParallelism) {
        if (hostParallelism <= 0) return UNKNOWN_HOST_WORKERS;
        return Math.min(hostParallelism, MAX_DEFAULT_WORKERS);
    }

    private static int bandCap(int unitCount, long bytesPerUnit) {
        if (bytesPerUnit > 0 && bytesPerUnit < LIGHT_BYTES_PER_UNIT) {
            // 821-page text run: 4 workers matched 16 at a fraction of the memory
            return unitCount < 800 ? 16 : 4;
        }
        if (bytesPerUnit >= HEAVY_BYTES_PER_UNIT) {
            if (unitCount < 150) return 4;
            if (unitCount < 300) return 16;
            return 8;
        }
        if (unitCount < 150) return 4;
        if (unitCount < 300) return 8;
        return 4;
    }
}
