package io.github.koszti.segmentstore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "store.fetch")
public class StoreFetchProperties {

    /**
     * Number of threads in the shared segment fetch pool.
     */
    private int parallelism = Runtime.getRuntime().availableProcessors();

    /**
     * Maximum number of segment fetches a single read keeps in flight.
     * Defaults to {@link #parallelism}.
     */
    private Integer maxInFlightSegments;

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public int getMaxInFlightSegments() {
        if (maxInFlightSegments == null) {
            return Math.max(1, parallelism);
        }
        return Math.max(1, maxInFlightSegments);
    }

    public void setMaxInFlightSegments(Integer maxInFlightSegments) {
        this.maxInFlightSegments = maxInFlightSegments;
    }
}
