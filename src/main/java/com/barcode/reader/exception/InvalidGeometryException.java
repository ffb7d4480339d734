package com.barcode.reader.exception;

/**
 * Raised when a crop rectangle does not fit the buffer or a rotation is not a quarter turn.
 */
public class InvalidGeometryException extends BarcodeReaderException {

    public InvalidGeometryException(String message) {
        super(message);
    }
}
