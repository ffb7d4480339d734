package com.barcode.reader.exception;

/**
 * Base type for failures raised while adapting an image for, or translating a result from, the
 * decoding engine. A missing symbol is not a failure and never surfaces as one of these.
 */
public class BarcodeReaderException extends RuntimeException {

    public BarcodeReaderException(String message) {
        super(message);
    }

    public BarcodeReaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
