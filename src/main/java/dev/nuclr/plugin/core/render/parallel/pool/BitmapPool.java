package dev.nuclr.plugin.core.render.parallel.pool;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Per-worker pool of reusable page bitmaps, matched by exact size and format.
 *
 * <p>Thread-affine: a pool is created by, used by and cleared by one thread
 * only, so it carries no lock. Pooled bitmaps are freed only by an explicit
 * {@link #clear()} from the owning thread; nothing frees them implicitly
 * when the pool becomes unreachable.
 */
@Slf4j
public final class BitmapPool {

    public static final int DEFAULT_MAX_SIZE = 32;

    private final int maxSize;
    private final BitmapAllocator allocator;
    private final Thread owner = Thread.currentThread();
    private final List<PageBitmap> pool = new ArrayList<>();
    private long allocations;

    public BitmapPool() {
        this(DEFAULT_MAX_SIZE, BitmapAllocator.DEFAULT);
    }

    public BitmapPool(int maxSize, BitmapAllocator allocator) {
        if (maxSize < 0) throw new IllegalArgumentException("maxSize must be >= 0");
        this.maxSize   = maxSize;
        this.allocator = allocator;
    }

    /**
     * Take a pooled bitmap of the exact shape, or allocate a new one.
     *
     * @return the bitmap, or null if allocation failed
     */
    public PageBitmap acquire(int width, int height, OutputFormat format) {
        checkOwner();
        for (Iterator<PageBitmap> it = pool.iterator(); it.hasNext(); ) {
            PageBitmap bitmap = it.next();
            if (bitmap.matches(width, height, format)) {
                it.remove();
                return bitmap;
            }
        }
        try {
            PageBitmap bitmap = allocator.allocate(width, height, format);
            allocations++;
            return bitmap;
        } catch (IllegalArgumentException | OutOfMemoryError e) {
            log.warn("Cannot allocate {}x{} {} bitmap: {}", width, height, format, e.toString());
            return null;
        }
    }

    /** Return a bitmap to the pool, or destroy it if the pool is full. */
    public void release(PageBitmap bitmap) {
        if (bitmap == null || bitmap.isDestroyed()) return;
        checkOwner();
        if (pool.size() < maxSize) {
            pool.add(bitmap);
        } else {
            bitmap.destroy();
        }
    }

    /** Destroy every pooled bitmap. Must run on the owning thread. */
    public void clear() {
        checkOwner();
        if (pool.isEmpty()) return;
        log.debug("Clearing {} pooled bitmaps on {}", pool.size(), owner.getName());
        for (PageBitmap bitmap : pool) {
            bitmap.destroy();
        }
        pool.clear();
    }

    public int size() {
        return pool.size();
    }

    public int maxSize() {
        return maxSize;
    }

    /** Number of bitmaps this pool has allocated so far. */
    public long allocations() {
        return allocations;
    }

    private void checkOwner() {
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException("BitmapPool owned by " + owner.getName()
                    + " used from " + Thread.currentThread().getName());
        }
    }
}
