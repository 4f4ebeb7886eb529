package io.github.koszti.segmentstore.metadata;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable metadata of a stored file. Immutable once written.
 *
 * @param id           opaque file identifier (UUID string)
 * @param name         client supplied file name
 * @param size         total size in bytes, equal to the sum of all segment sizes
 * @param segmentCount number of segments, equal to the number of segment records
 * @param createdAt    creation timestamp
 */
public record FileRecord(
        String id,
        String name,
        long size,
        int segmentCount,
        Instant createdAt
) {
    public FileRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        if (segmentCount < 0) {
            throw new IllegalArgumentException("segmentCount must not be negative: " + segmentCount);
        }
    }
}
