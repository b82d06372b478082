package com.acme.vision.pipeline.nodes;

import com.acme.vision.pipeline.context.WorkerContext;
import com.acme.vision.pipeline.memory.CachingFrameBufferPool;
import com.acme.vision.pipeline.memory.FrameDescriptor;
import com.acme.vision.pipeline.memory.Timestamp;
import com.acme.vision.pipeline.telemetry.AtomicPipelineMetrics;
import io.netty.buffer.UnpooledByteBufAllocator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class ReadbackOutputTest {
    private static final FrameDescriptor DESCRIPTOR = FrameDescriptor.rgba(1, 2);

    private AtomicPipelineMetrics metrics;
    private WorkerContext context;
    private CachingFrameBufferPool pool;

    @BeforeEach
    void setUp() {
        metrics = new AtomicPipelineMetrics();
        context = new WorkerContext("readback-test", 64, metrics).start();
        pool = new CachingFrameBufferPool(new UnpooledByteBufAllocator(false), 1 << 20, 4, 600, true, metrics);
    }

    @AfterEach
    void tearDown() {
        context.close();
        pool.close();
    }

    @Test
    void shouldCopyPixelsAndReleaseTheBuffer() throws Exception {
        FrameInput input = new FrameInput(context, pool);
        ReadbackOutput output = new ReadbackOutput(context);
        List<ReadbackOutput.Readback> readbacks = new ArrayList<>();
        output.setDataAvailableCallback(readbacks::add);
        input.addTarget(output).get(5, TimeUnit.SECONDS);

        byte[] pixels = {1, 2, 3, 4, 5, 6, 7, 8};
        assertInstanceOf(FrameOutcome.Broadcast.class,
            input.submitFrame(RawFrame.video(DESCRIPTOR, pixels, Timestamp.of(3, 30))).get(5, TimeUnit.SECONDS));

        assertEquals(1, readbacks.size());
        ReadbackOutput.Readback readback = readbacks.get(0);
        assertArrayEquals(pixels, readback.pixels());
        assertEquals(DESCRIPTOR, readback.descriptor());
        assertEquals(Timestamp.of(3, 30), readback.timing().timestamp().orElseThrow());
        assertEquals(0, pool.stats().liveBuffers());
        assertEquals(1, pool.idleCount(DESCRIPTOR));
    }

    @Test
    void shouldReleaseWithoutCallback() throws Exception {
        FrameInput input = new FrameInput(context, pool);
        ReadbackOutput output = new ReadbackOutput(context);
        input.addTarget(output).get(5, TimeUnit.SECONDS);

        input.submitFrame(RawFrame.still(DESCRIPTOR, new byte[8])).get(5, TimeUnit.SECONDS);

        assertEquals(0, pool.stats().liveBuffers());
    }

    @Test
    void shouldContainCallbackFailureWithoutDoubleRelease() throws Exception {
        FrameInput input = new FrameInput(context, pool);
        ReadbackOutput output = new ReadbackOutput(context);
        output.setDataAvailableCallback(readback -> {
            throw new IllegalStateException("callback failed");
        });
        input.addTarget(output).get(5, TimeUnit.SECONDS);

        input.submitFrame(RawFrame.still(DESCRIPTOR, new byte[8])).get(5, TimeUnit.SECONDS);

        AtomicPipelineMetrics.Snapshot snapshot = metrics.snapshot();
        assertEquals(1L, snapshot.consumerFailures());
        assertEquals(0L, snapshot.refCountViolations());
        assertEquals(0, pool.stats().liveBuffers());
    }
}
