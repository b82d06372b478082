package com.acme.vision.pipeline.nodes;

import com.acme.vision.pipeline.context.WorkerContext;
import com.acme.vision.pipeline.graph.TestNodes.Delivery;
import com.acme.vision.pipeline.graph.TestNodes.RecordingConsumer;
import com.acme.vision.pipeline.memory.CachingFrameBufferPool;
import com.acme.vision.pipeline.memory.FrameBuffer;
import com.acme.vision.pipeline.memory.FrameDescriptor;
import com.acme.vision.pipeline.memory.FrameTiming;
import com.acme.vision.pipeline.telemetry.NoopPipelineMetrics;
import com.acme.vision.pipeline.util.PipelineStatusCodes;
import io.netty.buffer.UnpooledByteBufAllocator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StillImageSourceTest {
    private static final FrameDescriptor DESCRIPTOR = FrameDescriptor.rgba(2, 2);

    private WorkerContext context;
    private CachingFrameBufferPool pool;
    private final List<Delivery> deliveries = new ArrayList<>();

    @BeforeEach
    void setUp() {
        context = new WorkerContext("still-test", 64, NoopPipelineMetrics.INSTANCE).start();
        pool = new CachingFrameBufferPool(new UnpooledByteBufAllocator(false), 1 << 20, 4, 600, true, null);
    }

    @AfterEach
    void tearDown() {
        context.close();
        pool.close();
    }

    @Test
    void shouldRefuseToProcessBeforeUpload() throws Exception {
        StillImageSource source = new StillImageSource(context, pool);
        FrameOutcome.Denied denied = assertInstanceOf(FrameOutcome.Denied.class,
            source.processImage().get(5, TimeUnit.SECONDS));
        assertEquals(PipelineStatusCodes.CONFLICT, denied.reasonCode());
    }

    @Test
    void shouldBroadcastUploadedPixelsAndKeepItsHold() throws Exception {
        StillImageSource source = new StillImageSource(context, pool);
        ReadbackOutput output = new ReadbackOutput(context);
        List<ReadbackOutput.Readback> readbacks = new ArrayList<>();
        output.setDataAvailableCallback(readbacks::add);
        RecordingConsumer other = new RecordingConsumer(context, "other", 1, deliveries);
        source.addTarget(output).get(5, TimeUnit.SECONDS);
        source.addTarget(other).get(5, TimeUnit.SECONDS);
        byte[] pixels = new byte[(int) DESCRIPTOR.byteSize()];
        Arrays.fill(pixels, (byte) 7);

        source.upload(RawFrame.still(DESCRIPTOR, pixels)).get(5, TimeUnit.SECONDS);
        FrameOutcome.Broadcast broadcast = assertInstanceOf(FrameOutcome.Broadcast.class,
            source.processImage().get(5, TimeUnit.SECONDS));

        assertEquals(2, broadcast.targetCount());
        assertEquals(1, readbacks.size());
        assertArrayEquals(pixels, readbacks.get(0).pixels());
        assertEquals(FrameTiming.STILL_IMAGE, readbacks.get(0).timing());
        assertEquals(1, pool.stats().liveBuffers());

        source.close();
        assertEquals(0, pool.stats().liveBuffers());
        assertEquals(1, pool.idleCount(DESCRIPTOR));
    }

    @Test
    void shouldReplayOnlyToNewTargetAfterProcessing() throws Exception {
        StillImageSource source = new StillImageSource(context, pool);
        RecordingConsumer early = new RecordingConsumer(context, "early", 1, deliveries);
        RecordingConsumer beforeProcessing = new RecordingConsumer(context, "before", 1, deliveries);
        RecordingConsumer late = new RecordingConsumer(context, "late", 1, deliveries);
        source.addTarget(early).get(5, TimeUnit.SECONDS);
        source.upload(RawFrame.still(DESCRIPTOR, new byte[(int) DESCRIPTOR.byteSize()])).get(5, TimeUnit.SECONDS);

        source.addTarget(beforeProcessing).get(5, TimeUnit.SECONDS);
        assertTrue(deliveries.isEmpty());

        source.processImage().get(5, TimeUnit.SECONDS);
        source.addTarget(late).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("early", "before", "late"), deliveries.stream().map(Delivery::consumer).toList());
        source.close();
        assertEquals(1, pool.idleCount(DESCRIPTOR));
    }

    @Test
    void shouldReleasePreviousImageOnReupload() throws Exception {
        StillImageSource source = new StillImageSource(context, pool);
        byte[] pixels = new byte[(int) DESCRIPTOR.byteSize()];
        source.upload(RawFrame.still(DESCRIPTOR, pixels)).get(5, TimeUnit.SECONDS);
        source.upload(RawFrame.still(DESCRIPTOR, pixels)).get(5, TimeUnit.SECONDS);

        assertEquals(1, pool.stats().liveBuffers());
        source.close();
        assertEquals(0, pool.stats().liveBuffers());
    }

    @Test
    void shouldKeepSingleHoldWhenSameImageIsSetTwice() throws Exception {
        StillImageSource source = new StillImageSource(context, pool);
        FrameBuffer buffer = pool.acquireBufferOrThrow(DESCRIPTOR);

        source.setImage(buffer).get(5, TimeUnit.SECONDS);
        source.setImage(buffer).get(5, TimeUnit.SECONDS);

        assertEquals(1, buffer.refCount());
        assertEquals(0, pool.idleCount(DESCRIPTOR));
        assertInstanceOf(FrameOutcome.Broadcast.class, source.processImage().get(5, TimeUnit.SECONDS));
        assertEquals(1, buffer.refCount());

        source.close();
        assertEquals(0, buffer.refCount());
        assertEquals(1, pool.idleCount(DESCRIPTOR));
    }
}
