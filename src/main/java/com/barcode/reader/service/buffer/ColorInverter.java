package com.barcode.reader.service.buffer;

import java.awt.image.BufferedImage;
import java.awt.image.RescaleOp;

/**
 * Produces the photographic negative of a {@link PixelBuffer}. Engines tuned for dark-on-light
 * symbols can then be retried on light-on-dark ones without touching the camera again.
 */
public class ColorInverter {

    private static final float[] SCALES = {-1f, -1f, -1f, 1f};
    private static final float[] OFFSETS = {255f, 255f, 255f, 0f};

    private final RescaleOp invertOp = new RescaleOp(SCALES, OFFSETS, null);

    /**
     * Returns a new buffer where every intensity {@code v} became {@code 255 - v}. The input is left
     * untouched.
     */
    public PixelBuffer invert(PixelBuffer source) {
        BufferedImage argb = expand(source);
        BufferedImage inverted = invertOp.filter(argb, null);
        return collapse(inverted);
    }

    // Channels are written through the raster rather than Graphics2D, which would apply a
    // linear-gray to sRGB conversion and break the exact 255 - v relation.
    private static BufferedImage expand(PixelBuffer source) {
        int width = source.width();
        int height = source.height();
        BufferedImage argb = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        byte[] data = source.data();
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            int offset = y * source.rowStride();
            for (int x = 0; x < width; x++) {
                int v = data[offset + x] & 0xFF;
                row[x] = 0xFF000000 | (v << 16) | (v << 8) | v;
            }
            argb.setRGB(0, y, width, 1, row, 0, width);
        }
        return argb;
    }

    private static PixelBuffer collapse(BufferedImage argb) {
        int width = argb.getWidth();
        int height = argb.getHeight();
        PixelBuffer target = PixelBuffer.allocate(width, height);
        byte[] data = target.data();
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            argb.getRGB(0, y, width, 1, row, 0, width);
            int offset = y * target.rowStride();
            for (int x = 0; x < width; x++) {
                data[offset + x] = (byte) ((row[x] >> 16) & 0xFF);
            }
        }
        return target;
    }
}
