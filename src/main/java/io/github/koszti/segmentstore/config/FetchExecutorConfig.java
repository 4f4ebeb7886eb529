package io.github.koszti.segmentstore.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared pool for segment downloads. Sized once per process; each read bounds its own
 * share of it through {@code store.fetch.max-in-flight-segments}.
 */
@Configuration
public class FetchExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(FetchExecutorConfig.class);

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService segmentFetchExecutor(StoreFetchProperties props) {
        int threads = Math.max(1, props.getParallelism());
        log.info("Starting segment fetch pool with {} threads", threads);
        return Executors.newFixedThreadPool(threads, fetchThreadFactory());
    }

    private static ThreadFactory fetchThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "segment-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
