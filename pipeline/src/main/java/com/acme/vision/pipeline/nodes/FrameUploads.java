package com.acme.vision.pipeline.nodes;

import com.acme.vision.pipeline.memory.FrameBuffer;
import com.acme.vision.pipeline.memory.FrameBufferPool;
import com.acme.vision.pipeline.memory.LeaseResult;
import com.acme.vision.pipeline.telemetry.PipelineMetrics;

import java.nio.ByteBuffer;
import java.util.logging.Logger;

/**
 * Copies host pixels into a pooled buffer.
 */
final class FrameUploads {
    private static final Logger LOG = Logger.getLogger(FrameUploads.class.getName());

    private FrameUploads() {
    }

    /**
     * Leases a buffer for {@code frame} and fills it. On success the returned lease holds one
     * reference owned by the caller; a denial is counted as a dropped frame.
     */
    static LeaseResult upload(FrameBufferPool pool, RawFrame frame, PipelineMetrics metrics) {
        LeaseResult lease = pool.acquireBuffer(frame.descriptor());
        if (lease instanceof LeaseResult.Denied denied) {
            LOG.warning("Pool denied buffer for " + frame.descriptor() + " reason=" + denied.reasonCode());
            metrics.incFramesDropped(1L, denied.reasonCode());
            return lease;
        }
        FrameBuffer buffer = ((LeaseResult.Granted) lease).buffer();
        ByteBuffer pixels = frame.pixels().duplicate();
        pixels.limit(pixels.position() + (int) frame.descriptor().byteSize());
        buffer.data().setBytes(0, pixels);
        buffer.setTiming(frame.timing());
        return lease;
    }
}
