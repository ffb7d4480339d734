package com.barcode.reader.service.buffer;

import com.barcode.reader.exception.InvalidImageFormatException;
import com.barcode.reader.frame.CameraFrame;
import com.barcode.reader.frame.PixelFormat;
import java.nio.ByteBuffer;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single reusable {@link PixelBuffer} of a capture session and fills it from camera
 * frames. Not thread-safe; callers keep at most one {@link #acquire(CameraFrame)} in flight.
 */
public class PixelBufferManager {

    private static final Logger log = LoggerFactory.getLogger(PixelBufferManager.class);

    public static final PixelFormat CAPTURE_FORMAT = PixelFormat.YUV_420_888;

    private PixelBuffer buffer;

    /**
     * Copies the luma plane of {@code frame} into the retained buffer, reallocating it only when the
     * frame size changed. The plane is checked against the frame size before the buffer is touched,
     * so a rejected frame leaves {@link #current()} as it was. The frame is closed before this method
     * returns, whatever the outcome.
     *
     * @throws InvalidImageFormatException when the frame is not {@link #CAPTURE_FORMAT}
     */
    public PixelBuffer acquire(CameraFrame frame) {
        try (frame) {
            if (frame.format() != CAPTURE_FORMAT) {
                throw new InvalidImageFormatException(frame.format(), CAPTURE_FORMAT);
            }
            if (frame.planes().isEmpty()) {
                throw new IllegalArgumentException("Frame carries no pixel planes");
            }
            int width = frame.width();
            int height = frame.height();
            CameraFrame.Plane luma = frame.planes().get(0);
            requireLumaFits(luma, width, height);
            if (buffer == null || !buffer.hasSize(width, height)) {
                log.debug("Allocating {}x{} pixel buffer (previous: {})", width, height, buffer);
                buffer = PixelBuffer.allocate(width, height);
            }
            copyLuma(luma, buffer);
            return buffer;
        }
    }

    public Optional<PixelBuffer> current() {
        return Optional.ofNullable(buffer);
    }

    public void release() {
        buffer = null;
    }

    private static void requireLumaFits(CameraFrame.Plane plane, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Frame size must be positive but was " + width + "x" + height);
        }
        int rowStride = plane.rowStride();
        if (rowStride < width) {
            throw new IllegalArgumentException(
                    "Luma row stride " + rowStride + " is smaller than the frame width " + width);
        }
        if (plane.pixelStride() != 1) {
            throw new IllegalArgumentException("Luma pixel stride must be 1 but was " + plane.pixelStride());
        }
        long required = (long) (height - 1) * rowStride + width;
        int remaining = plane.buffer().remaining();
        if (remaining < required) {
            throw new IllegalArgumentException("Luma plane holds " + remaining + " bytes, " + required + " required");
        }
    }

    private static void copyLuma(CameraFrame.Plane plane, PixelBuffer target) {
        int width = target.width();
        int rowStride = plane.rowStride();
        ByteBuffer source = plane.buffer().duplicate();
        int base = source.position();
        byte[] destination = target.data();
        int destinationStride = target.rowStride();
        for (int row = 0; row < target.height(); row++) {
            source.position(base + row * rowStride);
            source.get(destination, row * destinationStride, width);
        }
    }
}
