package com.acme.vision.pipeline.memory;

/**
 * Pixel layouts a frame buffer can carry.
 */
public enum PixelFormat {
    RGBA8888(4),
    BGRA8888(4),
    LUMINANCE8(1),
    LUMINANCE_ALPHA88(2);

    private final int bytesPerPixel;

    PixelFormat(int bytesPerPixel) {
        this.bytesPerPixel = bytesPerPixel;
    }

    public int bytesPerPixel() {
        return bytesPerPixel;
    }
}
