package com.barcode.reader.model;

/**
 * Sub-region of an image, in pixels. A rectangle with a non-positive width or height is empty and
 * stands for the full image extent, whatever its origin. Callers taking untrusted input should
 * reject negative components before building one.
 */
public record CropRect(int left, int top, int width, int height) {

    public static final CropRect EMPTY = new CropRect(0, 0, 0, 0);

    public static CropRect full(int width, int height) {
        return new CropRect(0, 0, width, height);
    }

    public boolean isEmpty() {
        return width <= 0 || height <= 0;
    }

    public int right() {
        return left + width;
    }

    public int bottom() {
        return top + height;
    }

    public boolean fitsWithin(int boundsWidth, int boundsHeight) {
        return left >= 0 && top >= 0
                && (long) left + width <= boundsWidth
                && (long) top + height <= boundsHeight;
    }
}
