package com.acme.vision.pipeline.graph;

/** Both ends of an edge: consumes on its input slots, broadcasts its output. */
public interface ImageProcessingOperation extends ImageSource, ImageConsumer {
}
