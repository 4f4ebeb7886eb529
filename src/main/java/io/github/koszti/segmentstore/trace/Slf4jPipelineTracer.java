package io.github.koszti.segmentstore.trace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Writes finished spans to the log at DEBUG, e.g.
 * {@code span read_file/fetch_segments_parallel finished in 12 ms {segment_count=10}}.
 */
public class Slf4jPipelineTracer implements PipelineTracer {

    private static final Logger log = LoggerFactory.getLogger(Slf4jPipelineTracer.class);

    @Override
    public PipelineSpan startSpan(String name) {
        return new LoggingSpan(name);
    }

    private static final class LoggingSpan implements PipelineSpan {
        private final String path;
        private final long startNanos = System.nanoTime();
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private Throwable error;
        private boolean closed;

        private LoggingSpan(String path) {
            this.path = path;
        }

        @Override
        public synchronized PipelineSpan setAttribute(String key, Object value) {
            attributes.put(key, value);
            return this;
        }

        @Override
        public synchronized void recordError(Throwable error) {
            this.error = error;
        }

        @Override
        public PipelineSpan startChild(String name) {
            return new LoggingSpan(path + "/" + name);
        }

        @Override
        public synchronized void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (!log.isDebugEnabled()) {
                return;
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            if (error != null) {
                log.debug("span {} failed after {} ms {}: {}", path, elapsedMs, attributes, error.toString());
            } else {
                log.debug("span {} finished in {} ms {}", path, elapsedMs, attributes);
            }
        }
    }
}
