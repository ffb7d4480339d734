package com.barcode.reader.exception;

import com.barcode.reader.frame.PixelFormat;

/**
 * Raised when a camera frame is not in the pixel format the buffer manager copies from.
 */
public class InvalidImageFormatException extends BarcodeReaderException {

    private final PixelFormat actual;

    public InvalidImageFormatException(PixelFormat actual, PixelFormat expected) {
        super("invalid image format: " + actual + " (expected " + expected + ")");
        this.actual = actual;
    }

    public PixelFormat actual() {
        return actual;
    }
}
