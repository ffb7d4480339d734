package com.barcode.reader.model;

import java.time.Duration;
import java.util.Objects;

/**
 * A decoded symbol.
 *
 * @param format the symbol format, never {@link BarcodeFormat#NONE} for a found symbol
 * @param text   decoded content, may be {@code null}
 * @param time   engine-reported processing time; for development diagnostics only
 */
public record DecodeResult(BarcodeFormat format, String text, Duration time) {

    public DecodeResult {
        Objects.requireNonNull(format, "format");
    }
}
