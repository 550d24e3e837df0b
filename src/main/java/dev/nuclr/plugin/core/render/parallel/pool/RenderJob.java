package dev.nuclr.plugin.core.render.parallel.pool;

import dev.nuclr.plugin.core.render.parallel.PageCallback;
import dev.nuclr.plugin.core.render.parallel.backend.DocumentLock;
import dev.nuclr.plugin.core.render.parallel.backend.FormOverlay;
import dev.nuclr.plugin.core.render.parallel.backend.RenderDocument;

/**
 * One page to render. Immutable; owned by the queue until exactly one worker
 * dequeues it.
 *
 * @param width     output width in pixels, 0 together with {@code height} to size from {@code dpi}
 * @param height    output height in pixels
 * @param rotation  quarter turns clockwise, 0..3
 * @param dpi       resolution used when width and height are 0
 * @param collector deferred release collector of the batch, or null to close the page right after its callback
 */
public record RenderJob(
        JobKind kind,
        RenderDocument document,
        DocumentLock lock,
        int pageIndex,
        int width,
        int height,
        int rotation,
        double dpi,
        OutputFormat format,
        FormOverlay formOverlay,
        PageCallback callback,
        Object userData,
        PageHandleCollector collector) {

    public boolean isAutoSized() {
        return width == 0 && height == 0 && dpi > 0;
    }
}
