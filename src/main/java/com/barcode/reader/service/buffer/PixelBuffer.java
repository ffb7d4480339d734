package com.barcode.reader.service.buffer;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.Objects;

/**
 * Mutable single-channel (8-bit intensity) image. Rows are packed, so the row stride always equals
 * the width.
 */
public final class PixelBuffer {

    private final BufferedImage image;

    private PixelBuffer(BufferedImage image) {
        this.image = image;
    }

    public static PixelBuffer allocate(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Buffer dimensions must be positive: " + width + "x" + height);
        }
        return new PixelBuffer(new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY));
    }

    /**
     * Copies an arbitrary image into a new buffer. Gray images are copied sample for sample, any
     * other type is converted to intensity by the AWT pipeline.
     */
    public static PixelBuffer fromImage(BufferedImage source) {
        if (source == null) {
            throw new IllegalArgumentException("Input image cannot be null");
        }
        PixelBuffer buffer = allocate(source.getWidth(), source.getHeight());
        if (source.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            buffer.image.getRaster().setRect(source.getRaster());
            return buffer;
        }
        Graphics2D g = buffer.image.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return buffer;
    }

    /**
     * Wraps intensity samples, one byte per pixel, row by row.
     */
    public static PixelBuffer wrap(byte[] pixels, int width, int height) {
        Objects.requireNonNull(pixels, "pixels");
        PixelBuffer buffer = allocate(width, height);
        if (pixels.length != width * height) {
            throw new IllegalArgumentException(
                    "Expected " + width * height + " pixels but got " + pixels.length);
        }
        System.arraycopy(pixels, 0, buffer.data(), 0, pixels.length);
        return buffer;
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }

    public int rowStride() {
        return image.getWidth();
    }

    /**
     * Live pixel storage. Writes are visible through {@link #image()}.
     */
    public byte[] data() {
        return ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
    }

    public int intensityAt(int x, int y) {
        return data()[y * rowStride() + x] & 0xFF;
    }

    /**
     * Live view of the buffer as a {@link BufferedImage#TYPE_BYTE_GRAY} image.
     */
    public BufferedImage image() {
        return image;
    }

    public boolean hasSize(int width, int height) {
        return width() == width && height() == height;
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width() + "x" + height() + "]";
    }
}
