package com.barcode.reader.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Symbol formats known to the reader. The engine reports results by the exact constant name, so this
 * enumeration is a contract shared with every {@code BarcodeEngine} implementation. Bump
 * {@link #CONTRACT_VERSION} whenever a constant is added, removed or renamed.
 */
public enum BarcodeFormat {
    NONE,
    AZTEC,
    CODABAR,
    CODE_39,
    CODE_93,
    CODE_128,
    DATA_BAR,
    DATA_BAR_EXPANDED,
    DATA_MATRIX,
    EAN_8,
    EAN_13,
    ITF,
    MAXICODE,
    PDF_417,
    QR_CODE,
    UPC_A,
    UPC_E;

    public static final int CONTRACT_VERSION = 1;

    /**
     * Resolves a format by its exact constant name. Unlike {@link #valueOf(String)} an unknown name
     * yields an empty result instead of an exception.
     */
    public static Optional<BarcodeFormat> fromName(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(format -> format.name().equals(name))
                .findFirst();
    }
}
