package io.github.koszti.segmentstore.trace;

/**
 * A named unit of pipeline work. Closing the span marks its end.
 */
public interface PipelineSpan extends AutoCloseable {

    PipelineSpan setAttribute(String key, Object value);

    void recordError(Throwable error);

    /**
     * Starts a span nested under this one. Safe to call from worker threads.
     */
    PipelineSpan startChild(String name);

    @Override
    void close();
}
