package com.barcode.reader.model;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable decoding configuration.
 *
 * @param formats   formats to accept; empty accepts any known format
 * @param tryHarder ask the engine for a slower, more exhaustive search
 * @param tryRotate ask the engine to also search rotated orientations
 */
public record DecodeOptions(Set<BarcodeFormat> formats, boolean tryHarder, boolean tryRotate) {

    public static final String FORMAT_SEPARATOR = ",";

    public DecodeOptions {
        formats = copyFormats(formats);
    }

    public static DecodeOptions defaults() {
        return new DecodeOptions(Set.of(), false, false);
    }

    public static DecodeOptions of(Collection<BarcodeFormat> formats) {
        return new DecodeOptions(copyFormats(formats), false, false);
    }

    public DecodeOptions withFormats(Collection<BarcodeFormat> newFormats) {
        return new DecodeOptions(copyFormats(newFormats), tryHarder, tryRotate);
    }

    public DecodeOptions withTryHarder(boolean value) {
        return new DecodeOptions(formats, value, tryRotate);
    }

    public DecodeOptions withTryRotate(boolean value) {
        return new DecodeOptions(formats, tryHarder, value);
    }

    private static Set<BarcodeFormat> copyFormats(Collection<BarcodeFormat> formats) {
        if (formats == null || formats.isEmpty()) {
            return Set.of();
        }
        EnumSet<BarcodeFormat> copy = EnumSet.noneOf(BarcodeFormat.class);
        for (BarcodeFormat format : formats) {
            copy.add(Objects.requireNonNull(format, "formats must not contain null entries"));
        }
        return Set.copyOf(copy);
    }

    /**
     * Serialises the accepted formats for the engine. Names follow enum declaration order so the
     * result does not depend on the iteration order of the backing set. An empty string means no
     * restriction.
     */
    public String formatList() {
        if (formats.isEmpty()) {
            return "";
        }
        return EnumSet.copyOf(formats).stream()
                .map(BarcodeFormat::name)
                .collect(Collectors.joining(FORMAT_SEPARATOR));
    }
}
