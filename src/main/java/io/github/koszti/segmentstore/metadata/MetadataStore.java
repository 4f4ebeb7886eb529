package io.github.koszti.segmentstore.metadata;

import java.util.List;
import java.util.Optional;

/**
 * Durable store for file and segment records.
 * Failures surface as {@link io.github.koszti.segmentstore.exception.StorageDependencyException}.
 */
public interface MetadataStore {

    void createFile(FileRecord file);

    void createSegment(SegmentRecord segment);

    /**
     * Persist a file record and all of its segments. The file record is written first.
     * Implementations that support transactions make this atomic.
     */
    default void createFileWithSegments(FileRecord file, List<SegmentRecord> segments) {
        createFile(file);
        for (SegmentRecord segment : segments) {
            createSegment(segment);
        }
    }

    Optional<FileRecord> getFile(String fileId);

    /**
     * All segment records of {@code fileId}, ordered by order index ascending.
     */
    List<SegmentRecord> getSegments(String fileId);
}
