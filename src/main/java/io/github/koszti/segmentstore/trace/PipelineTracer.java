package io.github.koszti.segmentstore.trace;

/**
 * Receives span markers for each pipeline step and each concurrent fetch unit.
 * Implementations must not block, throw, or change pipeline behaviour.
 */
public interface PipelineTracer {

    PipelineSpan startSpan(String name);
}
