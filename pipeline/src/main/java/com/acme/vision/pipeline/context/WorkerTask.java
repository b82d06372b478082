package com.acme.vision.pipeline.context;

record WorkerTask(
    Runnable task,
    long enqueueNanos
) {}
