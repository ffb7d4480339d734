package com.barcode.reader.service.engine;

import com.barcode.reader.service.buffer.PixelBuffer;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.LuminanceSource;
import com.google.zxing.MultiFormatReader;
import com.google.zxing.NotFoundException;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link BarcodeEngine} backed by the ZXing library. A fresh {@link MultiFormatReader} is used per
 * call, so one instance can serve concurrent readers.
 */
@Component
public class ZxingBarcodeEngine implements BarcodeEngine {

    private static final Logger log = LoggerFactory.getLogger(ZxingBarcodeEngine.class);

    @Override
    public EngineOutcome read(PixelBuffer buffer, int left, int top, int width, int height, int rotation,
                              String formats, boolean tryHarder, boolean tryRotate) {
        long started = System.nanoTime();
        Map<DecodeHintType, Object> hints;
        try {
            hints = hints(formats, tryHarder);
        } catch (IllegalArgumentException ex) {
            return EngineOutcome.error(ex.getMessage(), elapsedSince(started));
        }
        try {
            LuminanceSource source = rotateClockwise(
                    new BufferedImageLuminanceSource(buffer.image(), left, top, width, height), rotation);
            Result result = decode(source, hints, tryRotate);
            Duration elapsed = elapsedSince(started);
            if (result == null) {
                return EngineOutcome.notFound(elapsed);
            }
            String status = ZxingFormats.fromZxing(result.getBarcodeFormat())
                    .map(Enum::name)
                    .orElse(result.getBarcodeFormat().name());
            log.debug("ZXing decoded {} in {} ms", status, elapsed.toMillis());
            return new EngineOutcome(status, result.getText(), elapsed);
        } catch (RuntimeException ex) {
            log.warn("ZXing failed on {}: {}", buffer, ex.toString());
            return EngineOutcome.error(ex.getClass().getSimpleName() + ": " + ex.getMessage(), elapsedSince(started));
        }
    }

    private Result decode(LuminanceSource source, Map<DecodeHintType, Object> hints, boolean tryRotate) {
        Result result = decodeOnce(source, hints);
        if (result == null && tryRotate && source.isRotateSupported()) {
            result = decodeOnce(source.rotateCounterClockwise(), hints);
        }
        return result;
    }

    private Result decodeOnce(LuminanceSource source, Map<DecodeHintType, Object> hints) {
        MultiFormatReader reader = new MultiFormatReader();
        try {
            return reader.decode(new BinaryBitmap(new HybridBinarizer(source)), hints);
        } catch (NotFoundException ex) {
            return null;
        } finally {
            reader.reset();
        }
    }

    private static Map<DecodeHintType, Object> hints(String formats, boolean tryHarder) {
        Map<DecodeHintType, Object> hints = new EnumMap<>(DecodeHintType.class);
        Collection<com.google.zxing.BarcodeFormat> possible = ZxingFormats.parseList(formats);
        if (!possible.isEmpty()) {
            hints.put(DecodeHintType.POSSIBLE_FORMATS, possible);
        }
        if (tryHarder) {
            hints.put(DecodeHintType.TRY_HARDER, Boolean.TRUE);
        }
        return hints;
    }

    static LuminanceSource rotateClockwise(LuminanceSource source, int rotation) {
        int quarterTurns = Math.floorMod(-rotation, 360) / 90;
        LuminanceSource rotated = source;
        for (int i = 0; i < quarterTurns; i++) {
            rotated = rotated.rotateCounterClockwise();
        }
        return rotated;
    }

    private static Duration elapsedSince(long started) {
        return Duration.ofNanos(System.nanoTime() - started);
    }
}
