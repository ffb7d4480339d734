package com.barcode.reader.service.reader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.barcode.reader.exception.DecodeEngineException;
import com.barcode.reader.exception.InvalidGeometryException;
import com.barcode.reader.exception.InvalidImageFormatException;
import com.barcode.reader.frame.BufferedCameraFrame;
import com.barcode.reader.frame.PixelFormat;
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
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class BarcodeReaderTest {

    private BarcodeEngine engine;
    private BarcodeReader reader;
    private PixelBuffer buffer;

    @BeforeEach
    void setUp() {
        engine = mock(BarcodeEngine.class);
        reader = new BarcodeReader(engine);
        buffer = PixelBuffer.allocate(100, 60);
    }

    @Nested
    @DisplayName("translation")
    class Translation {

        @Test
        void knownFormatBecomesResult() {
            givenEngineReturns(new EngineOutcome("QR_CODE", "hello", Duration.ofMillis(12)));

            Optional<DecodeResult> result = reader.read(buffer, CropRect.EMPTY, 0);

            assertThat(result).contains(new DecodeResult(BarcodeFormat.QR_CODE, "hello", Duration.ofMillis(12)));
        }

        @Test
        void notFoundSentinelIgnoresPayload() {
            givenEngineReturns(new EngineOutcome(BarcodeEngine.NOT_FOUND, "stale text", Duration.ofMillis(3)));

            assertThat(reader.read(buffer, CropRect.EMPTY, 0)).isEmpty();
        }

        @Test
        void absentStatusIsNotFound() {
            givenEngineReturns(new EngineOutcome(null, "stale text", null));

            assertThat(reader.read(buffer, CropRect.EMPTY, 0)).isEmpty();
        }

        @Test
        void emptyStatusAndNoneFormatAreNotFound() {
            givenEngineReturns(new EngineOutcome("", null, null));
            assertThat(reader.read(buffer, CropRect.EMPTY, 0)).isEmpty();

            givenEngineReturns(new EngineOutcome("NONE", "x", null));
            assertThat(reader.read(buffer, CropRect.EMPTY, 0)).isEmpty();
        }

        @Test
        void otherStatusIsEngineErrorCarryingStatusVerbatim() {
            givenEngineReturns(new EngineOutcome("Some internal engine failure", "ignored", null));

            assertThatThrownBy(() -> reader.read(buffer, CropRect.EMPTY, 0))
                    .hasMessage("Some internal engine failure")
                    .isInstanceOfSatisfying(DecodeEngineException.class,
                            ex -> assertThat(ex.engineStatus()).isEqualTo("Some internal engine failure"));
        }

        @Test
        void formatNamesAreCaseSensitive() {
            givenEngineReturns(new EngineOutcome("qr_code", "hello", null));

            assertThatThrownBy(() -> reader.read(buffer, CropRect.EMPTY, 0))
                    .isInstanceOf(DecodeEngineException.class);
        }
    }

    @Nested
    @DisplayName("geometry")
    class Geometry {

        @Test
        void emptyCropResolvesToFullExtent() {
            givenEngineReturns(EngineOutcome.notFound(null));

            reader.read(buffer, CropRect.EMPTY, 0);

            verify(engine).read(same(buffer), eq(0), eq(0), eq(100), eq(60), eq(0), eq(""), eq(false), eq(false));
        }

        @Test
        void explicitCropIsPassedThrough() {
            givenEngineReturns(EngineOutcome.notFound(null));

            reader.read(buffer, new CropRect(10, 5, 90, 55), 90);

            verify(engine).read(same(buffer), eq(10), eq(5), eq(90), eq(55), eq(90), anyString(), anyBoolean(),
                    anyBoolean());
        }

        @Test
        void cropWiderThanBufferFailsBeforeEngineCall() {
            assertThatThrownBy(() -> reader.read(buffer, new CropRect(20, 0, 81, 10), 0))
                    .isInstanceOf(InvalidGeometryException.class);

            verifyNoInteractions(engine);
        }

        @Test
        void cropTallerThanBufferOrNegativeOriginFails() {
            assertThatThrownBy(() -> reader.read(buffer, new CropRect(0, 10, 10, 51), 0))
                    .isInstanceOf(InvalidGeometryException.class);
            assertThatThrownBy(() -> reader.read(buffer, new CropRect(-1, 0, 10, 10), 0))
                    .isInstanceOf(InvalidGeometryException.class);

            verifyNoInteractions(engine);
        }

        @Test
        void rotationIsNormalizedToQuarterTurns() {
            givenEngineReturns(EngineOutcome.notFound(null));

            reader.read(buffer, CropRect.EMPTY, -90);
            reader.read(buffer, CropRect.EMPTY, 450);

            verify(engine).read(any(), anyInt(), anyInt(), anyInt(), anyInt(), eq(270), anyString(), anyBoolean(),
                    anyBoolean());
            verify(engine).read(any(), anyInt(), anyInt(), anyInt(), anyInt(), eq(90), anyString(), anyBoolean(),
                    anyBoolean());
        }

        @Test
        void nonQuarterRotationIsRejected() {
            assertThatThrownBy(() -> reader.read(buffer, CropRect.EMPTY, 45))
                    .isInstanceOf(InvalidGeometryException.class);

            verifyNoInteractions(engine);
        }
    }

    @Nested
    @DisplayName("options")
    class Options {

        @Test
        void serializesExplicitOptions() {
            givenEngineReturns(EngineOutcome.notFound(null));
            DecodeOptions options = new DecodeOptions(Set.of(BarcodeFormat.QR_CODE, BarcodeFormat.EAN_13), true, true);

            reader.read(buffer, options, CropRect.EMPTY, 0);

            verify(engine).read(any(), anyInt(), anyInt(), anyInt(), anyInt(), anyInt(), eq("EAN_13,QR_CODE"), eq(true),
                    eq(true));
        }

        @Test
        void usesReaderDefaultsSetBetweenCalls() {
            givenEngineReturns(EngineOutcome.notFound(null));

            reader.setOptions(DecodeOptions.of(Set.of(BarcodeFormat.CODE_128)).withTryHarder(true));
            reader.read(buffer, CropRect.EMPTY, 0);

            verify(engine).read(any(), anyInt(), anyInt(), anyInt(), anyInt(), anyInt(), eq("CODE_128"), eq(true),
                    eq(false));
            assertThat(reader.getOptions().formats()).containsExactly(BarcodeFormat.CODE_128);
        }

        @Test
        void callsEngineExactlyOncePerRead() {
            givenEngineReturns(EngineOutcome.notFound(null));

            reader.read(buffer, CropRect.EMPTY, 0);

            verify(engine, times(1)).read(any(), anyInt(), anyInt(), anyInt(), anyInt(), anyInt(), anyString(),
                    anyBoolean(), anyBoolean());
        }
    }

    @Nested
    @DisplayName("camera frames")
    class Frames {

        @Test
        void decodesFrameWithItsOwnCropAndRotation() {
            givenEngineReturns(new EngineOutcome("EAN_13", "5901234123457", null));
            AtomicBoolean released = new AtomicBoolean();
            BufferedCameraFrame frame = BufferedCameraFrame
                    .ofLuma(filled(100 * 60, 30), 100, 60, 100, new CropRect(10, 10, 50, 40), 270)
                    .onRelease(() -> released.set(true));

            Optional<DecodeResult> result = reader.read(frame);

            assertThat(result).map(DecodeResult::format).contains(BarcodeFormat.EAN_13);
            assertThat(released).isTrue();
            ArgumentCaptor<PixelBuffer> captor = ArgumentCaptor.forClass(PixelBuffer.class);
            verify(engine).read(captor.capture(), eq(10), eq(10), eq(50), eq(40), eq(270), anyString(), anyBoolean(),
                    anyBoolean());
            assertThat(captor.getValue().intensityAt(5, 5)).isEqualTo(30);
        }

        @Test
        void invertedReadDecodesNegativeAndKeepsSessionBuffer() {
            givenEngineReturns(EngineOutcome.notFound(null));
            PixelBufferManager manager = new PixelBufferManager();
            BarcodeReader sessionReader = new BarcodeReader(engine, manager, new ColorInverter(),
                    DecodeOptions.defaults());

            sessionReader.read(BufferedCameraFrame.ofLuma(filled(16, 40), 4, 4, 4), true);

            ArgumentCaptor<PixelBuffer> captor = ArgumentCaptor.forClass(PixelBuffer.class);
            verify(engine).read(captor.capture(), anyInt(), anyInt(), anyInt(), anyInt(), anyInt(), anyString(),
                    anyBoolean(), anyBoolean());
            assertThat(captor.getValue().intensityAt(0, 0)).isEqualTo(215);
            assertThat(manager.current()).hasValueSatisfying(retained -> {
                assertThat(retained).isNotSameAs(captor.getValue());
                assertThat(retained.intensityAt(0, 0)).isEqualTo(40);
            });
        }

        @Test
        void staticBitmapIsDecodedOverFullExtent() {
            givenEngineReturns(new EngineOutcome("AZTEC", "bitmap", null));

            Optional<DecodeResult> result = reader.read(new BufferedImage(30, 20, BufferedImage.TYPE_INT_RGB));

            assertThat(result).map(DecodeResult::text).contains("bitmap");
            verify(engine).read(any(), eq(0), eq(0), eq(30), eq(20), eq(0), anyString(), anyBoolean(), anyBoolean());
        }

        @Test
        void consecutiveFramesShareBuffer() {
            givenEngineReturns(EngineOutcome.notFound(null));

            reader.read(BufferedCameraFrame.ofLuma(filled(16, 1), 4, 4, 4));
            reader.read(BufferedCameraFrame.ofLuma(filled(16, 2), 4, 4, 4));

            ArgumentCaptor<PixelBuffer> captor = ArgumentCaptor.forClass(PixelBuffer.class);
            verify(engine, times(2)).read(captor.capture(), anyInt(), anyInt(), anyInt(), anyInt(), anyInt(),
                    anyString(), anyBoolean(), anyBoolean());
            assertThat(captor.getAllValues().get(0)).isSameAs(captor.getAllValues().get(1));
        }

        @Test
        void unsupportedFrameFormatNeverReachesEngine() {
            BufferedCameraFrame frame = BufferedCameraFrame.ofLuma(filled(16, 1), 4, 4, 4)
                    .withFormat(PixelFormat.JPEG);

            assertThatThrownBy(() -> reader.read(frame)).isInstanceOf(InvalidImageFormatException.class);

            verifyNoInteractions(engine);
            assertThat(frame.isClosed()).isTrue();
        }

        @Test
        void geometryErrorStillReleasesFrame() {
            BufferedCameraFrame frame = BufferedCameraFrame.ofLuma(filled(16, 1), 4, 4, 4, new CropRect(2, 2, 4, 4), 0);

            assertThatThrownBy(() -> reader.read(frame)).isInstanceOf(InvalidGeometryException.class);

            assertThat(frame.isClosed()).isTrue();
            verify(engine, never()).read(any(), anyInt(), anyInt(), anyInt(), anyInt(), anyInt(), anyString(),
                    anyBoolean(), anyBoolean());
        }
    }

    private void givenEngineReturns(EngineOutcome outcome) {
        when(engine.read(any(), anyInt(), anyInt(), anyInt(), anyInt(), anyInt(), anyString(), anyBoolean(),
                anyBoolean())).thenReturn(outcome);
    }

    private static byte[] filled(int size, int value) {
        byte[] data = new byte[size];
        Arrays.fill(data, (byte) value);
        return data;
    }
}
