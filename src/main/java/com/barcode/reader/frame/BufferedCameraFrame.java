package com.barcode.reader.frame;

import com.barcode.reader.model.CropRect;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;

/**
 * In-memory {@link CameraFrame} over caller-supplied byte buffers. The optional release hook runs
 * once, on the first {@link #close()}.
 */
public final class BufferedCameraFrame implements CameraFrame {

    private final int width;
    private final int height;
    private final PixelFormat format;
    private final List<Plane> planes;
    private final CropRect cropRect;
    private final int rotationDegrees;
    private final Runnable onRelease;
    private boolean closed;

    public BufferedCameraFrame(int width, int height, PixelFormat format, List<Plane> planes,
                               CropRect cropRect, int rotationDegrees, Runnable onRelease) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Frame dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.format = Objects.requireNonNull(format, "format");
        this.planes = List.copyOf(planes);
        this.cropRect = cropRect == null ? CropRect.EMPTY : cropRect;
        this.rotationDegrees = rotationDegrees;
        this.onRelease = onRelease;
    }

    /**
     * Wraps a bare luma plane as a {@link PixelFormat#YUV_420_888} frame. Chroma planes are not
     * needed for decoding and are left out.
     */
    public static BufferedCameraFrame ofLuma(byte[] luma, int width, int height, int rowStride) {
        return ofLuma(luma, width, height, rowStride, CropRect.EMPTY, 0);
    }

    public static BufferedCameraFrame ofLuma(byte[] luma, int width, int height, int rowStride,
                                             CropRect cropRect, int rotationDegrees) {
        Plane plane = new Plane(ByteBuffer.wrap(luma), rowStride, 1);
        return new BufferedCameraFrame(width, height, PixelFormat.YUV_420_888, List.of(plane),
                cropRect, rotationDegrees, null);
    }

    public BufferedCameraFrame withFormat(PixelFormat newFormat) {
        return new BufferedCameraFrame(width, height, newFormat, planes, cropRect, rotationDegrees, onRelease);
    }

    public BufferedCameraFrame onRelease(Runnable hook) {
        return new BufferedCameraFrame(width, height, format, planes, cropRect, rotationDegrees, hook);
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public PixelFormat format() {
        return format;
    }

    @Override
    public List<Plane> planes() {
        return planes;
    }

    @Override
    public CropRect cropRect() {
        return cropRect;
    }

    @Override
    public int rotationDegrees() {
        return rotationDegrees;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (onRelease != null) {
            onRelease.run();
        }
    }
}
