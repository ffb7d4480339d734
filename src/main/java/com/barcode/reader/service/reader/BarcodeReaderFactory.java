package com.barcode.reader.service.reader;

import com.barcode.reader.config.BarcodeProperties;
import com.barcode.reader.service.buffer.ColorInverter;
import com.barcode.reader.service.buffer.PixelBufferManager;
import com.barcode.reader.service.engine.BarcodeEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Creates {@link BarcodeReader} instances preconfigured with the application's default options. Each
 * reader owns its own pixel buffer, so hand out one per capture session or request.
 */
@Component
public class BarcodeReaderFactory {

    private static final Logger log = LoggerFactory.getLogger(BarcodeReaderFactory.class);

    private final BarcodeEngine engine;
    private final BarcodeProperties properties;

    public BarcodeReaderFactory(BarcodeEngine engine, BarcodeProperties properties) {
        this.engine = engine;
        this.properties = properties;
        log.info("Barcode reader defaults: {}", properties.defaultOptions());
    }

    public BarcodeReader newReader() {
        return new BarcodeReader(engine, new PixelBufferManager(), new ColorInverter(), properties.defaultOptions());
    }
}
