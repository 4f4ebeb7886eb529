package io.github.koszti.segmentstore.trace;

public final class NoopPipelineTracer implements PipelineTracer {

    public static final NoopPipelineTracer INSTANCE = new NoopPipelineTracer();

    private static final PipelineSpan NOOP_SPAN = new PipelineSpan() {
        @Override
        public PipelineSpan setAttribute(String key, Object value) {
            return this;
        }

        @Override
        public void recordError(Throwable error) {
        }

        @Override
        public PipelineSpan startChild(String name) {
            return this;
        }

        @Override
        public void close() {
        }
    };

    private NoopPipelineTracer() {}

    @Override
    public PipelineSpan startSpan(String name) {
        return NOOP_SPAN;
    }
}
