package dev.nuclr.plugin.core.render.parallel.pool;

import java.awt.image.BufferedImage;

/**
 * Pixel layout of a rendered page buffer.
 */
public enum OutputFormat {
    /** 4 bytes per pixel, blue-green-red, fourth byte unused. */
    BGRX(BufferedImage.TYPE_INT_RGB, 4),
    /** 3 bytes per pixel, blue-green-red. */
    BGR(BufferedImage.TYPE_3BYTE_BGR, 3),
    /** 1 byte per pixel; forces grayscale rendering. */
    GRAY(BufferedImage.TYPE_BYTE_GRAY, 1);

    final int imageType;
    final int bytesPerPixel;

    OutputFormat(int imageType, int bytesPerPixel) {
        this.imageType = imageType;
        this.bytesPerPixel = bytesPerPixel;
    }

    public int bytesPerPixel() {
        return bytesPerPixel;
    }
}
