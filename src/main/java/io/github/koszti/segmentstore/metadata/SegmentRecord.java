package io.github.koszti.segmentstore.metadata;

import java.util.Objects;

/**
 * Durable metadata of one segment of a file.
 *
 * @param id         opaque segment identifier
 * @param fileId     owning file
 * @param orderIndex zero-based position of the segment within the file
 * @param hash       lowercase hex SHA-256 of the bytes stored at {@code blobKey}
 * @param blobKey    key of the segment bytes in the blob store
 * @param size       segment size in bytes
 */
public record SegmentRecord(
        String id,
        String fileId,
        int orderIndex,
        String hash,
        String blobKey,
        long size
) {
    public SegmentRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(fileId, "fileId must not be null");
        Objects.requireNonNull(hash, "hash must not be null");
        Objects.requireNonNull(blobKey, "blobKey must not be null");
        if (orderIndex < 0) {
            throw new IllegalArgumentException("orderIndex must not be negative: " + orderIndex);
        }
    }
}
