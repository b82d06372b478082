package com.acme.vision.pipeline.nodes;

import com.acme.vision.pipeline.memory.FrameDescriptor;
import com.acme.vision.pipeline.memory.FrameTiming;
import com.acme.vision.pipeline.memory.Timestamp;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Host-memory pixels handed to a producer node, before upload into a pooled buffer.
 * {@code pixels} must hold at least {@link FrameDescriptor#byteSize()} remaining bytes.
 */
public record RawFrame(FrameDescriptor descriptor, ByteBuffer pixels, FrameTiming timing) {

    public RawFrame {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(pixels, "pixels");
        Objects.requireNonNull(timing, "timing");
        if (pixels.remaining() < descriptor.byteSize()) {
            throw new IllegalArgumentException("Frame " + descriptor + " needs " + descriptor.byteSize()
                + " bytes, got " + pixels.remaining());
        }
        pixels = pixels.asReadOnlyBuffer();
    }

    public static RawFrame still(FrameDescriptor descriptor, byte[] pixels) {
        return new RawFrame(descriptor, ByteBuffer.wrap(pixels), FrameTiming.STILL_IMAGE);
    }

    public static RawFrame video(FrameDescriptor descriptor, byte[] pixels, Timestamp presentationTime) {
        return new RawFrame(descriptor, ByteBuffer.wrap(pixels), FrameTiming.videoFrame(presentationTime));
    }
}
