package io.github.koszti.segmentstore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "store.cache")
public class StoreCacheProperties {

    /**
     * How long a file record stays cached after a read populates it.
     */
    private Duration ttl = Duration.ofMinutes(5);

    /**
     * Maximum number of cached file records.
     */
    private long maximumSize = 10_000;

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public long getMaximumSize() {
        return Math.max(1, maximumSize);
    }

    public void setMaximumSize(long maximumSize) {
        this.maximumSize = maximumSize;
    }
}
