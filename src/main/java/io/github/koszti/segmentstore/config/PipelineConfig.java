package io.github.koszti.segmentstore.config;

import io.github.koszti.segmentstore.cache.CaffeineMetadataCache;
import io.github.koszti.segmentstore.cache.MetadataCache;
import io.github.koszti.segmentstore.segment.Segmenter;
import io.github.koszti.segmentstore.trace.NoopPipelineTracer;
import io.github.koszti.segmentstore.trace.PipelineTracer;
import io.github.koszti.segmentstore.trace.Slf4jPipelineTracer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

    @Bean
    public Segmenter segmenter(StoreSegmentProperties segmentProps) {
        return new Segmenter(segmentProps.getSizeBytes());
    }

    @Bean
    public MetadataCache metadataCache(StoreCacheProperties cacheProps) {
        return new CaffeineMetadataCache(cacheProps.getMaximumSize());
    }

    @Bean
    @ConditionalOnProperty(prefix = "store.tracing", name = "enabled", havingValue = "true", matchIfMissing = true)
    public PipelineTracer slf4jPipelineTracer() {
        return new Slf4jPipelineTracer();
    }

    @Bean
    @ConditionalOnProperty(prefix = "store.tracing", name = "enabled", havingValue = "false")
    public PipelineTracer noopPipelineTracer() {
        return NoopPipelineTracer.INSTANCE;
    }
}
