package com.acme.vision.pipeline.runtime;

import com.acme.vision.pipeline.config.PipelineConfig;
import com.acme.vision.pipeline.memory.FrameDescriptor;
import com.acme.vision.pipeline.memory.LeaseResult;
import com.acme.vision.pipeline.nodes.FrameInput;
import com.acme.vision.pipeline.nodes.FrameOutcome;
import com.acme.vision.pipeline.nodes.ImageRelay;
import com.acme.vision.pipeline.nodes.RawFrame;
import com.acme.vision.pipeline.nodes.ReadbackOutput;
import com.acme.vision.pipeline.telemetry.AtomicPipelineMetrics;
import com.acme.vision.pipeline.telemetry.NoopPipelineMetrics;
import com.acme.vision.pipeline.util.PipelineEnvKeys;
import com.acme.vision.pipeline.util.PipelineStatusCodes;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineRuntimeTest {
    private static final FrameDescriptor DESCRIPTOR = FrameDescriptor.rgba(2, 1);

    @Test
    void shouldRunAGraphOnTheSharedPieces() throws Exception {
        List<ReadbackOutput.Readback> readbacks = new ArrayList<>();
        try (PipelineRuntime runtime = PipelineRuntime.start(PipelineConfig.defaults())) {
            assertTrue(runtime.context().isRunning());
            AtomicPipelineMetrics metrics = assertInstanceOf(AtomicPipelineMetrics.class, runtime.metrics());

            FrameInput input = new FrameInput(runtime.context(), runtime.pool());
            ImageRelay relay = new ImageRelay(runtime.context());
            ReadbackOutput output = new ReadbackOutput(runtime.context());
            output.setDataAvailableCallback(readbacks::add);
            input.then(relay).addTarget(output).get(5, TimeUnit.SECONDS);

            FrameOutcome outcome = input.submitFrame(RawFrame.still(DESCRIPTOR, new byte[8])).get(5, TimeUnit.SECONDS);

            assertInstanceOf(FrameOutcome.Broadcast.class, outcome);
            assertEquals(1, readbacks.size());
            assertEquals(2L, metrics.snapshot().broadcasts());
        }
    }

    @Test
    void shouldUseNoopMetricsWhenDisabled() {
        PipelineConfig config = PipelineConfig.fromEnv(Map.of(PipelineEnvKeys.PIPELINE_METRICS_ENABLED, "false"));
        try (PipelineRuntime runtime = PipelineRuntime.start(config)) {
            assertSame(NoopPipelineMetrics.INSTANCE, runtime.metrics());
            assertSame(config, runtime.config());
        }
    }

    @Test
    void shouldStopEverythingOnCloseAndTolerateASecondClose() {
        PipelineRuntime runtime = PipelineRuntime.start(PipelineConfig.defaults().withWorkerName("runtime-close"));
        assertEquals("runtime-close", runtime.context().name());

        runtime.close();
        runtime.close();

        assertFalse(runtime.context().isRunning());
        LeaseResult.Denied denied = assertInstanceOf(LeaseResult.Denied.class,
            runtime.pool().acquireBuffer(DESCRIPTOR));
        assertEquals(PipelineStatusCodes.SERVICE_UNAVAILABLE, denied.reasonCode());
    }
}
