package dev.nuclr.plugin.core.render.parallel.pool;

/**
 * Ownership variant of a {@link RenderJob}'s output buffer.
 */
public enum JobKind {
    /** A fresh bitmap per page; the callback owns it. */
    OWNED,
    /** A bitmap borrowed from the worker's {@link BitmapPool} for the callback only. */
    POOLED
}
