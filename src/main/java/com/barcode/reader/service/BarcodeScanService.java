package com.barcode.reader.service;

import com.barcode.reader.config.BarcodeProperties;
import com.barcode.reader.frame.CameraFrame;
import com.barcode.reader.model.CropRect;
import com.barcode.reader.model.DecodeResult;
import com.barcode.reader.model.ScanResult;
import com.barcode.reader.service.buffer.ColorInverter;
import com.barcode.reader.service.buffer.PixelBuffer;
import com.barcode.reader.service.reader.BarcodeReader;
import com.barcode.reader.service.reader.BarcodeReaderFactory;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Optional;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decodes uploaded images and raw camera frames. When enabled, a pass that finds nothing is retried
 * once on the inverted image so light-on-dark symbols are picked up too.
 */
@Service
public class BarcodeScanService {

    private static final Logger log = LoggerFactory.getLogger(BarcodeScanService.class);

    private final BarcodeReaderFactory readerFactory;
    private final ColorInverter inverter;
    private final BarcodeProperties properties;

    public BarcodeScanService(BarcodeReaderFactory readerFactory, BarcodeProperties properties) {
        this.readerFactory = readerFactory;
        this.inverter = new ColorInverter();
        this.properties = properties;
    }

    public Optional<ScanResult> decodeImage(byte[] imageBytes, CropRect cropRect, int rotation) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new IllegalArgumentException("Image payload must not be empty");
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to decode image payload: " + ex.getMessage(), ex);
        }
        if (image == null) {
            throw new IllegalArgumentException("Unsupported image encoding");
        }
        log.debug("Decoding {}x{} image", image.getWidth(), image.getHeight());
        return decodeWithRetry(readerFactory.newReader(), PixelBuffer.fromImage(image), cropRect, rotation);
    }

    public Optional<ScanResult> decodeFrame(CameraFrame frame) {
        CropRect cropRect = frame.cropRect();
        int rotation = frame.rotationDegrees();
        BarcodeReader reader = readerFactory.newReader();
        PixelBuffer buffer = reader.acquire(frame);
        log.debug("Decoding {}x{} frame", buffer.width(), buffer.height());
        return decodeWithRetry(reader, buffer, cropRect, rotation);
    }

    private Optional<ScanResult> decodeWithRetry(BarcodeReader reader, PixelBuffer buffer,
                                                 CropRect cropRect, int rotation) {
        Optional<DecodeResult> result = reader.read(buffer, cropRect, rotation);
        if (result.isPresent()) {
            return result.map(found -> new ScanResult(found, false));
        }
        if (!properties.retryInverted()) {
            return Optional.empty();
        }
        log.debug("Nothing found, retrying on inverted image");
        return reader.read(inverter.invert(buffer), cropRect, rotation)
                .map(found -> new ScanResult(found, true));
    }
}
