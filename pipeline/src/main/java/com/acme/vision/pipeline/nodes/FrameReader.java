package com.acme.vision.pipeline.nodes;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * Pull-based supply of decoded frames, e.g. a movie file demuxer.
 * Called from a single reader thread.
 */
public interface FrameReader extends Closeable {
    /**
     * @return the next frame, or empty at end of stream
     */
    Optional<RawFrame> next() throws IOException;

    /** Rewinds to the first frame. */
    void reset() throws IOException;
}
