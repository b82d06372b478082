package com.acme.vision.pipeline.memory;

import java.util.Objects;

/**
 * Size, pixel format and orientation of a frame. Value equality is the pool cache key.
 */
public record FrameDescriptor(
    int width,
    int height,
    PixelFormat format,
    ImageOrientation orientation
) {

    public FrameDescriptor {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Frame size must be positive, got " + width + "x" + height);
        }
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(orientation, "orientation");
    }

    public static FrameDescriptor rgba(int width, int height) {
        return new FrameDescriptor(width, height, PixelFormat.RGBA8888, ImageOrientation.PORTRAIT);
    }

    public long byteSize() {
        return (long) width * height * format.bytesPerPixel();
    }

    /** Size as seen by a consumer presenting in {@code target} orientation. */
    public FrameDescriptor sizedFor(ImageOrientation target) {
        if (orientation.rotationNeeded(target)) {
            return new FrameDescriptor(height, width, format, target);
        }
        return new FrameDescriptor(width, height, format, target);
    }
}
