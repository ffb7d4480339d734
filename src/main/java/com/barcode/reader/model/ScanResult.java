package com.barcode.reader.model;

/**
 * A decode result together with the pass that produced it.
 *
 * @param inverted whether the symbol was only found on the inverted image
 */
public record ScanResult(DecodeResult result, boolean inverted) {
}
