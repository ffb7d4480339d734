package com.barcode.reader.service.engine;

import com.barcode.reader.model.BarcodeFormat;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Translation between {@link BarcodeFormat} and ZXing's own format enumeration.
 */
final class ZxingFormats {

    private static final Map<BarcodeFormat, com.google.zxing.BarcodeFormat> TO_ZXING =
            new EnumMap<>(BarcodeFormat.class);
    private static final Map<com.google.zxing.BarcodeFormat, BarcodeFormat> FROM_ZXING =
            new EnumMap<>(com.google.zxing.BarcodeFormat.class);

    static {
        register(BarcodeFormat.AZTEC, com.google.zxing.BarcodeFormat.AZTEC);
        register(BarcodeFormat.CODABAR, com.google.zxing.BarcodeFormat.CODABAR);
        register(BarcodeFormat.CODE_39, com.google.zxing.BarcodeFormat.CODE_39);
        register(BarcodeFormat.CODE_93, com.google.zxing.BarcodeFormat.CODE_93);
        register(BarcodeFormat.CODE_128, com.google.zxing.BarcodeFormat.CODE_128);
        register(BarcodeFormat.DATA_BAR, com.google.zxing.BarcodeFormat.RSS_14);
        register(BarcodeFormat.DATA_BAR_EXPANDED, com.google.zxing.BarcodeFormat.RSS_EXPANDED);
        register(BarcodeFormat.DATA_MATRIX, com.google.zxing.BarcodeFormat.DATA_MATRIX);
        register(BarcodeFormat.EAN_8, com.google.zxing.BarcodeFormat.EAN_8);
        register(BarcodeFormat.EAN_13, com.google.zxing.BarcodeFormat.EAN_13);
        register(BarcodeFormat.ITF, com.google.zxing.BarcodeFormat.ITF);
        register(BarcodeFormat.MAXICODE, com.google.zxing.BarcodeFormat.MAXICODE);
        register(BarcodeFormat.PDF_417, com.google.zxing.BarcodeFormat.PDF_417);
        register(BarcodeFormat.QR_CODE, com.google.zxing.BarcodeFormat.QR_CODE);
        register(BarcodeFormat.UPC_A, com.google.zxing.BarcodeFormat.UPC_A);
        register(BarcodeFormat.UPC_E, com.google.zxing.BarcodeFormat.UPC_E);
    }

    private ZxingFormats() {
    }

    private static void register(BarcodeFormat format, com.google.zxing.BarcodeFormat zxing) {
        TO_ZXING.put(format, zxing);
        FROM_ZXING.put(zxing, format);
    }

    static com.google.zxing.BarcodeFormat toZxing(BarcodeFormat format) {
        com.google.zxing.BarcodeFormat zxing = TO_ZXING.get(format);
        if (zxing == null) {
            throw new IllegalArgumentException("No ZXing counterpart for " + format);
        }
        return zxing;
    }

    static Optional<BarcodeFormat> fromZxing(com.google.zxing.BarcodeFormat zxing) {
        return Optional.ofNullable(FROM_ZXING.get(zxing));
    }

    /**
     * Parses a comma separated list of {@link BarcodeFormat} names. Blank entries are skipped.
     *
     * @throws IllegalArgumentException naming the first unknown entry
     */
    static Collection<com.google.zxing.BarcodeFormat> parseList(String formats) {
        EnumSet<com.google.zxing.BarcodeFormat> parsed = EnumSet.noneOf(com.google.zxing.BarcodeFormat.class);
        if (formats == null || formats.isBlank()) {
            return parsed;
        }
        for (String token : formats.split(",")) {
            String name = token.trim().toUpperCase(Locale.ROOT);
            if (name.isEmpty()) {
                continue;
            }
            BarcodeFormat format = BarcodeFormat.fromName(name)
                    .filter(candidate -> candidate != BarcodeFormat.NONE)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown barcode format: " + token.trim()));
            parsed.add(toZxing(format));
        }
        return parsed;
    }
}
