package dev.nuclr.plugin.core.render.parallel.pool;

import dev.nuclr.plugin.core.render.parallel.backend.DocumentLock;
import dev.nuclr.plugin.core.render.parallel.backend.FormOverlay;
import dev.nuclr.plugin.core.render.parallel.backend.LoadedPage;
import lombok.extern.slf4j.Slf4j;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;

/**
 * Runs one {@link RenderJob}: load, draw and hand-off of the page inside a
 * single document-lock section, then the callback outside it.
 *
 * <p>Every job ends in exactly one callback. Load, size, allocation and
 * render failures, errors included, are reported as {@code success = false}
 * with a null bitmap. Nothing thrown by the callback escapes.
 */
@Slf4j
public final class PageRenderStep {

    private static final Color TRANSPARENT = new Color(0, 0, 0, 0);

    private PageRenderStep() {}

    /**
     * @param bitmaps the calling thread's pool for {@link JobKind#POOLED} jobs,
     *                ignored for owned jobs
     */
    public static void execute(RenderJob job, BitmapPool bitmaps) {
        BitmapPool pool = job.kind() == JobKind.POOLED ? bitmaps : null;
        LoadedPage page = null;
        PageBitmap bitmap = null;

        try (DocumentLock.Guard ignored = job.lock().acquire()) {
            page = load(job);
            if (page != null) {
                bitmap = renderLoaded(job, page, pool);
                handOff(job, page);
            }
        }

        deliver(job, bitmap);

        if (pool != null && bitmap != null) {
            pool.release(bitmap);
        }
        if (page != null && job.collector() == null) {
            try (DocumentLock.Guard ignored = job.lock().acquire()) {
                page.close();
            } catch (Throwable t) {
                log.warn("Error closing page {} of {}", job.pageIndex(), job.document().name(), t);
            }
        }
    }

    /**
     * Page size in pixels for {@code page}: the job's explicit size, or the
     * page size in points scaled by the job's dpi.
     *
     * @return {width, height}, or null if the computed size is empty
     */
    static int[] resolveSize(RenderJob job, LoadedPage page) {
        if (!job.isAutoSized()) {
            return new int[] {job.width(), job.height()};
        }
        double scale = Math.floor(job.dpi() / 72.0 * 1_000_000.0) / 1_000_000.0;
        int w = (int) (page.widthPoints() * scale);
        int h = (int) (page.heightPoints() * scale);
        if (w < 1 || h < 1) return null;
        return isQuarterTurn(job.rotation()) ? new int[] {h, w} : new int[] {w, h};
    }

    // ------------------------------------------------------------- internal

    private static LoadedPage load(RenderJob job) {
        try {
            LoadedPage page = job.document().loadPage(job.pageIndex());
            if (page == null) {
                log.warn("Cannot load page {} of {}", job.pageIndex(), job.document().name());
            }
            return page;
        } catch (Throwable t) {
            log.warn("Error loading page {} of {}", job.pageIndex(), job.document().name(), t);
            return null;
        }
    }

    /** Must be called with the document lock held. Returns null on failure. */
    private static PageBitmap renderLoaded(RenderJob job, LoadedPage page, BitmapPool pool) {
        FormOverlay overlay = job.formOverlay();
        PageBitmap bitmap = null;
        try {
            if (overlay != null) overlay.afterLoad(page);

            int[] size = resolveSize(job, page);
            if (size == null) {
                log.warn("Page {} of {} has an empty size at {} dpi", job.pageIndex(), job.document().name(), job.dpi());
                return null;
            }
            bitmap = pool != null
                    ? pool.acquire(size[0], size[1], job.format())
                    : allocateOwned(size[0], size[1], job.format());
            if (bitmap == null) return null;

            draw(job, page, bitmap);
            return bitmap;
        } catch (Throwable t) {
            log.warn("Error rendering page {} of {}", job.pageIndex(), job.document().name(), t);
            if (bitmap != null) {
                if (pool != null) pool.release(bitmap);
                else bitmap.destroy();
            }
            return null;
        }
    }

    private static PageBitmap allocateOwned(int width, int height, OutputFormat format) {
        try {
            return PageBitmap.allocate(width, height, format);
        } catch (IllegalArgumentException | OutOfMemoryError e) {
            log.warn("Cannot allocate {}x{} {} bitmap: {}", width, height, format, e.toString());
            return null;
        }
    }

    private static void draw(RenderJob job, LoadedPage page, PageBitmap bitmap) throws Exception {
        int w = bitmap.width();
        int h = bitmap.height();
        Graphics2D g = bitmap.image().createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.setColor(page.hasTransparency() ? TRANSPARENT : Color.WHITE);
            g.fillRect(0, 0, w, h);
            g.setComposite(AlphaComposite.SrcOver);

            switch (job.rotation()) {
                case 1 -> { g.translate(w, 0); g.rotate(Math.PI / 2); }
                case 2 -> { g.translate(w, h); g.rotate(Math.PI); }
                case 3 -> { g.translate(0, h); g.rotate(-Math.PI / 2); }
                default -> { }
            }
            boolean quarter = isQuarterTurn(job.rotation());
            float scaleX = (quarter ? h : w) / page.widthPoints();
            float scaleY = (quarter ? w : h) / page.heightPoints();

            page.render(g, scaleX, scaleY);
            if (job.formOverlay() != null) {
                job.formOverlay().draw(page, g, scaleX, scaleY);
            }
        } finally {
            g.dispose();
        }
    }

    /** Must be called with the document lock held. */
    private static void handOff(RenderJob job, LoadedPage page) {
        if (job.formOverlay() != null) {
            try {
                job.formOverlay().beforeClose(page);
            } catch (Throwable t) {
                log.warn("Form overlay failed closing page {}", job.pageIndex(), t);
            }
        }
        if (job.collector() != null) {
            job.collector().add(page);
        }
    }

    private static void deliver(RenderJob job, PageBitmap bitmap) {
        try {
            job.callback().onPage(job.pageIndex(), bitmap, job.userData(), bitmap != null);
        } catch (Throwable t) {
            log.error("Page callback failed for page {} of {}", job.pageIndex(), job.document().name(), t);
        }
    }

    private static boolean isQuarterTurn(int rotation) {
        return rotation % 2 != 0;
    }
}
