package io.github.koszti.segmentstore.config;

import io.github.koszti.segmentstore.pipeline.ReadResult;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "store.write")
public class StoreWriteProperties {

    /**
     * Delete the blobs uploaded by a write when the write fails before its metadata is committed.
     */
    private boolean cleanupOnFailure = true;

    /**
     * Largest file a write accepts. Capped at what a read can return in one piece.
     */
    private long maxFileSizeBytes = ReadResult.MAX_CONTENT_SIZE;

    public boolean isCleanupOnFailure() {
        return cleanupOnFailure;
    }

    public void setCleanupOnFailure(boolean cleanupOnFailure) {
        this.cleanupOnFailure = cleanupOnFailure;
    }

    public long getMaxFileSizeBytes() {
        return Math.min(maxFileSizeBytes, ReadResult.MAX_CONTENT_SIZE);
    }

    public void setMaxFileSizeBytes(long maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }
}
