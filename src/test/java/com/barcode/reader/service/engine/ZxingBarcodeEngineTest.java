package com.barcode.reader.service.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.barcode.reader.service.buffer.PixelBuffer;
import com.barcode.reader.support.BarcodeImages;
import java.awt.image.BufferedImage;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ZxingBarcodeEngineTest {

    private final ZxingBarcodeEngine engine = new ZxingBarcodeEngine();

    @Test
    void decodesQrCodeOverFullExtent() {
        PixelBuffer buffer = PixelBuffer.fromImage(BarcodeImages.qrCode(BarcodeImages.QR_TEXT, 240));

        EngineOutcome outcome = readFull(buffer, 0, "", false, false);

        assertThat(outcome.status()).isEqualTo("QR_CODE");
        assertThat(outcome.text()).isEqualTo(BarcodeImages.QR_TEXT);
        assertThat(outcome.time()).isNotNull();
    }

    @Test
    void reportsNotFoundOnBlankImage() {
        PixelBuffer buffer = PixelBuffer.fromImage(BarcodeImages.blank(200, 200));

        EngineOutcome outcome = readFull(buffer, 0, "", true, true);

        assertThat(outcome.status()).isEqualTo(BarcodeEngine.NOT_FOUND);
        assertThat(outcome.text()).isNull();
    }

    @Test
    void reportsUnknownFormatAsError() {
        PixelBuffer buffer = PixelBuffer.fromImage(BarcodeImages.qrCode(BarcodeImages.QR_TEXT, 240));

        EngineOutcome outcome = readFull(buffer, 0, "QR_CODE,HOLOGRAM", false, false);

        assertThat(outcome.status()).isEqualTo("Unknown barcode format: HOLOGRAM");
    }

    @Test
    void restrictsToRequestedFormats() {
        PixelBuffer buffer = PixelBuffer.fromImage(BarcodeImages.qrCode(BarcodeImages.QR_TEXT, 240));

        EngineOutcome outcome = readFull(buffer, 0, "EAN_13", false, false);

        assertThat(outcome.status()).isEqualTo(BarcodeEngine.NOT_FOUND);
    }

    @Test
    void decodesEan13() {
        PixelBuffer buffer = PixelBuffer.fromImage(BarcodeImages.ean13(BarcodeImages.EAN_13_DIGITS, 320, 120));

        EngineOutcome outcome = readFull(buffer, 0, "EAN_13", false, false);

        assertThat(outcome.status()).isEqualTo("EAN_13");
        assertThat(outcome.text()).isEqualTo(BarcodeImages.EAN_13_DIGITS);
    }

    @Nested
    class Geometry {

        private final PixelBuffer sideBySide = PixelBuffer.fromImage(BarcodeImages.onCanvas(
                BarcodeImages.qrCode(BarcodeImages.QR_TEXT, 200), 440, 220, 230, 10));

        @Test
        void cropExcludingSymbolFindsNothing() {
            EngineOutcome outcome = engine.read(sideBySide, 0, 0, 220, 220, 0, "QR_CODE", false, false);

            assertThat(outcome.status()).isEqualTo(BarcodeEngine.NOT_FOUND);
        }

        @Test
        void cropAroundSymbolDecodesIt() {
            EngineOutcome outcome = engine.read(sideBySide, 220, 0, 220, 220, 0, "QR_CODE", false, false);

            assertThat(outcome.status()).isEqualTo("QR_CODE");
            assertThat(outcome.text()).isEqualTo(BarcodeImages.QR_TEXT);
        }

        @Test
        void rotationRestoresSidewaysLinearBarcode() {
            BufferedImage sideways = BarcodeImages.rotateClockwise(
                    BarcodeImages.ean13(BarcodeImages.EAN_13_DIGITS, 320, 120));
            PixelBuffer buffer = PixelBuffer.fromImage(sideways);

            EngineOutcome upright = readFull(buffer, 90, "EAN_13", false, false);
            EngineOutcome unrotated = readFull(buffer, 0, "EAN_13", false, false);

            assertThat(upright.status()).isEqualTo("EAN_13");
            assertThat(upright.text()).isEqualTo(BarcodeImages.EAN_13_DIGITS);
            assertThat(unrotated.status()).isEqualTo(BarcodeEngine.NOT_FOUND);
        }

        @Test
        void tryRotateSearchesQuarterTurn() {
            BufferedImage sideways = BarcodeImages.rotateClockwise(
                    BarcodeImages.ean13(BarcodeImages.EAN_13_DIGITS, 320, 120));
            PixelBuffer buffer = PixelBuffer.fromImage(sideways);

            EngineOutcome outcome = readFull(buffer, 0, "EAN_13", false, true);

            assertThat(outcome.status()).isEqualTo("EAN_13");
        }
    }

    private EngineOutcome readFull(PixelBuffer buffer, int rotation, String formats, boolean tryHarder,
                                   boolean tryRotate) {
        return engine.read(buffer, 0, 0, buffer.width(), buffer.height(), rotation, formats, tryHarder, tryRotate);
    }
}
