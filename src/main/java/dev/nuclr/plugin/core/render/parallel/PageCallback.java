package dev.nuclr.plugin.core.render.parallel;

import dev.nuclr.plugin.core.render.parallel.pool.PageBitmap;

/**
 * Receives the result of one rendered page. Invoked exactly once per
 * submitted page, possibly from a pool thread, never under the document lock.
 */
@FunctionalInterface
public interface PageCallback {

    /**
     * @param pageIndex 0-based page index
     * @param bitmap    the rendered page, or null when {@code success} is false.
     *                  From {@link ParallelRenderer#renderPagesPooled} the bitmap is
     *                  only valid until this method returns; from
     *                  {@link ParallelRenderer#renderPages} the callee owns it.
     * @param userData  the value passed to the render call
     * @param success   false if the page could not be loaded or rendered
     */
    void onPage(int pageIndex, PageBitmap bitmap, Object userData, boolean success);
}
