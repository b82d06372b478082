package com.acme.vision.pipeline.memory;

import java.util.Objects;
import java.util.Optional;

/**
 * Timing tag carried by a frame buffer: static content or a video frame at a presentation time.
 */
public sealed interface FrameTiming permits FrameTiming.StillImage, FrameTiming.VideoFrame {

    StillImage STILL_IMAGE = new StillImage();

    static FrameTiming videoFrame(Timestamp timestamp) {
        return new VideoFrame(timestamp);
    }

    default Optional<Timestamp> timestamp() {
        return Optional.empty();
    }

    record StillImage() implements FrameTiming {}

    record VideoFrame(Timestamp presentationTime) implements FrameTiming {
        public VideoFrame {
            Objects.requireNonNull(presentationTime, "presentationTime");
        }

        @Override
        public Optional<Timestamp> timestamp() {
            return Optional.of(presentationTime);
        }
    }
}
