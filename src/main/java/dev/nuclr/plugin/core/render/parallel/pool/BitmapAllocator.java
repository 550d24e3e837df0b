package dev.nuclr.plugin.core.render.parallel.pool;

/**
 * Creates new page bitmaps for a {@link BitmapPool} on a pool miss.
 */
@FunctionalInterface
public interface BitmapAllocator {

    BitmapAllocator DEFAULT = PageBitmap::allocate;

    PageBitmap allocate(int width, int height, OutputFormat format);
}
