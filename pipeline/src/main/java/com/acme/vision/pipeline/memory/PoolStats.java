package com.acme.vision.pipeline.memory;

public record PoolStats(long allocations,
                        long reuses,
                        long recycled,
                        long destroyed,
                        long failedAllocations,
                        int idleBuffers,
                        int liveBuffers,
                        long retainedBytes) {}
