package io.github.koszti.segmentstore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "store.segment")
public class StoreSegmentProperties {

    /**
     * Segment size in bytes applied to every write. Keep it constant for the lifetime of a deployment.
     */
    private int sizeBytes = 1024 * 1024;

    public int getSizeBytes() {
        return sizeBytes;
    }

    public void setSizeBytes(int sizeBytes) {
        if (sizeBytes <= 0) {
            throw new IllegalArgumentException("store.segment.size-bytes must be positive: " + sizeBytes);
        }
        this.sizeBytes = sizeBytes;
    }
}
