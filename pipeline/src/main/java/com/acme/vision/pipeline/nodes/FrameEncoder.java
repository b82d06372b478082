package com.acme.vision.pipeline.nodes;

import com.acme.vision.pipeline.memory.FrameBuffer;
import com.acme.vision.pipeline.memory.Timestamp;

import java.io.IOException;

/**
 * Sink that writes timestamped frames, e.g. a video muxer. All calls arrive on the
 * recorder's encoding context.
 */
public interface FrameEncoder {
    /** Opens the output. */
    void start() throws IOException;

    /** Anchors the output timeline at the first frame's presentation time. */
    void startSession(Timestamp sourceTime);

    /** Whether the encoder can take another frame without blocking. */
    boolean isReady();

    /**
     * Writes the pixels of {@code buffer}. The buffer is only valid for the duration of the call.
     *
     * @return {@code false} when the encoder rejected the frame
     */
    boolean append(FrameBuffer buffer, Timestamp presentationTime);

    /** Flushes and closes the output. */
    void finish() throws IOException;
}
