package com.barcode.reader.api.dto;

import com.barcode.reader.model.BarcodeFormat;
import com.barcode.reader.model.ScanResult;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.Optional;

@Schema(description = "Outcome of a single decode request")
public record DecodeResponse(
        @Schema(description = "Whether a symbol was decoded")
        boolean found,
        @Schema(description = "Symbol format, NONE when nothing was found", example = "QR_CODE")
        BarcodeFormat format,
        @Schema(description = "Decoded content", example = "https://example.com")
        String text,
        @Schema(description = "Engine processing time in milliseconds, for diagnostics only")
        Long timeMillis,
        @Schema(description = "Whether the symbol was only found on the inverted image")
        boolean inverted) {

    public static DecodeResponse from(Optional<ScanResult> scan) {
        if (scan.isEmpty()) {
            return new DecodeResponse(false, BarcodeFormat.NONE, null, null, false);
        }
        ScanResult result = scan.get();
        Long time = result.result().time() == null ? null : result.result().time().toMillis();
        return new DecodeResponse(true, result.result().format(), result.result().text(), time, result.inverted());
    }
}
