package com.barcode.reader.service.engine;

import java.time.Duration;

/**
 * Everything a single engine call hands back.
 *
 * @param status raw status: a {@code BarcodeFormat} name, {@link BarcodeEngine#NOT_FOUND}, an
 *               engine error message, or {@code null}
 * @param text   decoded content when a symbol was found
 * @param time   time spent inside the engine, if measured
 */
public record EngineOutcome(String status, String text, Duration time) {

    public static EngineOutcome notFound(Duration time) {
        return new EngineOutcome(BarcodeEngine.NOT_FOUND, null, time);
    }

    public static EngineOutcome error(String message, Duration time) {
        return new EngineOutcome(message, null, time);
    }
}
