package com.barcode.reader.service.engine;

import com.barcode.reader.service.buffer.PixelBuffer;

/**
 * Call boundary to a barcode-decoding engine. Implementations report their outcome as a plain
 * string so that native engines can implement this contract without sharing Java types:
 * <ul>
 *     <li>the name of a {@code BarcodeFormat} constant when a symbol was decoded,</li>
 *     <li>{@link #NOT_FOUND} (or {@code null}) when the image holds no decodable symbol,</li>
 *     <li>any other string to report an engine-side error.</li>
 * </ul>
 * Calls are synchronous and may block for as long as the engine runs.
 */
public interface BarcodeEngine {

    String NOT_FOUND = "NotFound";

    /**
     * @param buffer    intensity image; must not be retained after the call
     * @param left      crop origin x
     * @param top       crop origin y
     * @param width     crop width, always positive
     * @param height    crop height, always positive
     * @param rotation  clockwise rotation in degrees, one of 0, 90, 180, 270
     * @param formats   comma separated {@code BarcodeFormat} names, empty for any format
     * @param tryHarder spend more time searching
     * @param tryRotate also search the image rotated by a quarter turn
     */
    EngineOutcome read(PixelBuffer buffer, int left, int top, int width, int height, int rotation,
                       String formats, boolean tryHarder, boolean tryRotate);
}
