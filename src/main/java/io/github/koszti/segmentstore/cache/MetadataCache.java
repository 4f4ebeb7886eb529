package io.github.koszti.segmentstore.cache;

import io.github.koszti.segmentstore.metadata.FileRecord;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL cache of file records. Soft state only: it has no authority over the metadata store,
 * and callers treat every failure as a miss.
 */
public interface MetadataCache {

    Optional<FileRecord> get(String fileId);

    void put(String fileId, FileRecord file, Duration ttl);

    void invalidate(String fileId);
}
