package dev.nuclr.plugin.core.render.parallel.backend;

import java.awt.Graphics2D;

/**
 * Optional form-field layer drawn on top of a rendered page.
 *
 * <p>All callbacks run on the worker thread, under the document lock, in the
 * order {@code afterLoad}, {@code draw}, {@code beforeClose}. {@code draw} is
 * skipped when no buffer could be obtained for the page.
 */
public interface FormOverlay {

    default void afterLoad(LoadedPage page) {}

    /**
     * Paint field appearances. {@code graphics} carries the same transform the
     * page was rendered with.
     */
    void draw(LoadedPage page, Graphics2D graphics, float scaleX, float scaleY);

    default void beforeClose(LoadedPage page) {}
}
