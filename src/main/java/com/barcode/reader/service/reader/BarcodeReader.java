package com.barcode.reader.service.reader;

import com.barcode.reader.exception.DecodeEngineException;
import com.barcode.reader.exception.InvalidGeometryException;
import com.barcode.reader.frame.CameraFrame;
import com.barcode.reader.model.BarcodeFormat;
import com.barcode.reader.model.CropRect;
import com.barcode.reader.model.DecodeOptions;
import com.barcode.reader.model.DecodeResult;
import com.barcode.reader.service.buffer.ColorInverter;
import com.barcode.reader.service.buffer.PixelBuffer;
import com.barcode.reader.service.buffer.PixelBufferManager;
import com.barcode.reader.service.engine.BarcodeEngine;
import com.barcode.reader.service.engine.EngineOutcome;
import java.awt.image.BufferedImage;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds camera frames and bitmaps to a {@link BarcodeEngine} and translates the engine's raw
 * status into a {@link DecodeResult}.
 *
 * <p>Each {@code read} call is an independent, blocking transaction with three outcomes: a result,
 * {@link Optional#empty()} when no symbol was found, or an exception. The only state kept between
 * calls is the pixel buffer reused across frames, so an instance must not be shared by concurrent
 * callers. Create one reader per capture session.
 */
public class BarcodeReader {

    private static final Logger log = LoggerFactory.getLogger(BarcodeReader.class);

    private final BarcodeEngine engine;
    private final PixelBufferManager bufferManager;
    private final ColorInverter inverter;
    private DecodeOptions options;

    public BarcodeReader(BarcodeEngine engine) {
        this(engine, new PixelBufferManager(), new ColorInverter(), DecodeOptions.defaults());
    }

    public BarcodeReader(BarcodeEngine engine, PixelBufferManager bufferManager, ColorInverter inverter,
                         DecodeOptions options) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.bufferManager = Objects.requireNonNull(bufferManager, "bufferManager");
        this.inverter = Objects.requireNonNull(inverter, "inverter");
        this.options = Objects.requireNonNull(options, "options");
    }

    public DecodeOptions getOptions() {
        return options;
    }

    public void setOptions(DecodeOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public Optional<DecodeResult> read(CameraFrame frame) {
        return read(frame, false);
    }

    /**
     * Copies the frame into the session buffer and decodes it. The frame is released once its
     * pixels are copied.
     *
     * @param invert decode the negative of the frame instead, for light-on-dark symbols
     */
    public Optional<DecodeResult> read(CameraFrame frame, boolean invert) {
        CropRect cropRect = frame.cropRect();
        int rotation = frame.rotationDegrees();
        PixelBuffer buffer = acquire(frame);
        if (invert) {
            buffer = inverter.invert(buffer);
        }
        return read(buffer, cropRect, rotation);
    }

    /**
     * Copies the frame into the session buffer without decoding it. The returned buffer is only
     * valid until the next frame is acquired.
     */
    public PixelBuffer acquire(CameraFrame frame) {
        return bufferManager.acquire(frame);
    }

    public Optional<DecodeResult> read(BufferedImage image) {
        return read(PixelBuffer.fromImage(image), CropRect.EMPTY, 0);
    }

    public Optional<DecodeResult> read(PixelBuffer buffer, CropRect cropRect, int rotation) {
        return read(buffer, options, cropRect, rotation);
    }

    public Optional<DecodeResult> read(PixelBuffer buffer, DecodeOptions options, CropRect cropRect, int rotation) {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(options, "options");
        CropRect region = resolveCrop(cropRect, buffer);
        int degrees = normalizeRotation(rotation);

        EngineOutcome outcome = engine.read(buffer, region.left(), region.top(), region.width(), region.height(),
                degrees, options.formatList(), options.tryHarder(), options.tryRotate());
        if (outcome == null) {
            return Optional.empty();
        }
        return translate(outcome);
    }

    static CropRect resolveCrop(CropRect cropRect, PixelBuffer buffer) {
        if (cropRect == null || cropRect.isEmpty()) {
            return CropRect.full(buffer.width(), buffer.height());
        }
        if (!cropRect.fitsWithin(buffer.width(), buffer.height())) {
            throw new InvalidGeometryException(String.format(
                    "Crop rectangle %s does not fit within a %dx%d buffer", cropRect, buffer.width(), buffer.height()));
        }
        return cropRect;
    }

    static int normalizeRotation(int rotation) {
        if (rotation % 90 != 0) {
            throw new InvalidGeometryException("Rotation must be a multiple of 90 degrees but was " + rotation);
        }
        return Math.floorMod(rotation, 360);
    }

    static Optional<DecodeResult> translate(EngineOutcome outcome) {
        String status = outcome.status();
        if (status == null || status.isEmpty() || BarcodeEngine.NOT_FOUND.equals(status)) {
            log.debug("No symbol found");
            return Optional.empty();
        }
        Optional<BarcodeFormat> format = BarcodeFormat.fromName(status);
        if (format.isEmpty()) {
            log.warn("Decoding engine reported an error: {}", status);
            throw new DecodeEngineException(status);
        }
        if (format.get() == BarcodeFormat.NONE) {
            return Optional.empty();
        }
        log.debug("Decoded {} symbol", format.get());
        return Optional.of(new DecodeResult(format.get(), outcome.text(), outcome.time()));
    }
}
