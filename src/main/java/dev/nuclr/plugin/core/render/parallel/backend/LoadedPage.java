package dev.nuclr.plugin.core.render.parallel.backend;

import java.awt.Graphics2D;

/**
 * A page loaded from a {@link RenderDocument}. Every method must be called
 * with the owning document's lock held.
 *
 * <p>Pages loaded by pool workers are never closed by the worker that loaded
 * them; they are handed to a deferred release collector and closed once the
 * whole batch has completed.
 */
public interface LoadedPage {

    int pageIndex();

    /** Displayed page width in PDF points, page rotation applied. */
    float widthPoints();

    /** Displayed page height in PDF points, page rotation applied. */
    float heightPoints();

    /** True when the page declares a transparency group. */
    boolean hasTransparency();

    /**
     * Draw the page into {@code graphics}, whose origin is the top-left
     * corner of the displayed page.
     */
    void render(Graphics2D graphics, float scaleX, float scaleY) throws Exception;

    /** Release the resources held for this page. */
    void close();
}
