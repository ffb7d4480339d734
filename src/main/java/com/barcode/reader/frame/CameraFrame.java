package com.barcode.reader.frame;

import com.barcode.reader.model.CropRect;
import java.nio.ByteBuffer;
import java.util.List;

/**
 * A single frame handed over by a camera pipeline. Frames are read synchronously and must be
 * closed as soon as their pixels have been copied, which returns the memory to the producer.
 */
public interface CameraFrame extends AutoCloseable {

    int width();

    int height();

    PixelFormat format();

    /**
     * Pixel planes in producer order. For {@link PixelFormat#YUV_420_888} plane 0 is luma.
     */
    List<Plane> planes();

    CropRect cropRect();

    int rotationDegrees();

    @Override
    void close();

    record Plane(ByteBuffer buffer, int rowStride, int pixelStride) {
    }
}
