package com.barcode.reader.config;

import com.barcode.reader.model.BarcodeFormat;
import com.barcode.reader.model.DecodeOptions;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "barcode")
public record BarcodeProperties(
        DecodeProperties decode,
        ScanProperties scan) {

    public record DecodeProperties(
            Set<BarcodeFormat> formats,
            boolean tryHarder,
            boolean tryRotate) {
    }

    public record ScanProperties(
            boolean retryInverted) {
    }

    public DecodeOptions defaultOptions() {
        if (decode == null) {
            return DecodeOptions.defaults();
        }
        return new DecodeOptions(decode.formats(), decode.tryHarder(), decode.tryRotate());
    }

    public boolean retryInverted() {
        return scan != null && scan.retryInverted();
    }
}
