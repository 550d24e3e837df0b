package dev.nuclr.plugin.core.render.parallel.pool;

import java.awt.image.BufferedImage;

/**
 * A fixed-shape output buffer for one rendered page.
 *
 * <p>Bitmaps handed out by the pooled render path belong to a worker's
 * {@link BitmapPool} and are valid only for the duration of the page
 * callback. Bitmaps from the owned render path belong to the callback.
 */
public final class PageBitmap {

    private final int width;
    private final int height;
    private final OutputFormat format;
    private BufferedImage image;

    private PageBitmap(int width, int height, OutputFormat format) {
        this.width  = width;
        this.height = height;
        this.format = format;
        this.image  = new BufferedImage(width, height, format.imageType);
    }

    /**
     * Allocate a new bitmap.
     *
     * @throws IllegalArgumentException if the dimensions are not positive
     * @throws OutOfMemoryError         if the pixel buffer cannot be allocated
     */
    public static PageBitmap allocate(int width, int height, OutputFormat format) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid bitmap size " + width + "x" + height);
        }
        return new PageBitmap(width, height, format);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public OutputFormat format() {
        return format;
    }

    /** Bytes per row of the pixel buffer. */
    public int stride() {
        return width * format.bytesPerPixel;
    }

    /** The backing image; its raster is the pixel buffer. */
    public BufferedImage image() {
        if (image == null) throw new IllegalStateException("Bitmap already destroyed");
        return image;
    }

    public boolean matches(int width, int height, OutputFormat format) {
        return this.width == width && this.height == height && this.format == format;
    }

    public boolean isDestroyed() {
        return image == null;
    }

    /** Drop the pixel buffer. Further use of {@link #image()} fails. */
    public void destroy() {
        if (image != null) {
            image.flush();
            image = null;
        }
    }
}
