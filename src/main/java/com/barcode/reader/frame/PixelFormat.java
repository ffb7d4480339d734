package com.barcode.reader.frame;

/**
 * Pixel layout tags a camera pipeline may deliver. Only {@link #YUV_420_888} is accepted for live
 * capture.
 */
public enum PixelFormat {
    YUV_420_888,
    NV21,
    RGBA_8888,
    JPEG
}
