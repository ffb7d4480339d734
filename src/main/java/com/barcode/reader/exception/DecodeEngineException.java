package com.barcode.reader.exception;

/**
 * The decoding engine reported an error instead of a result. The engine's status string is kept
 * verbatim as the exception message.
 */
public class DecodeEngineException extends BarcodeReaderException {

    private final String engineStatus;

    public DecodeEngineException(String engineStatus) {
        super(engineStatus);
        this.engineStatus = engineStatus;
    }

    public String engineStatus() {
        return engineStatus;
    }
}
