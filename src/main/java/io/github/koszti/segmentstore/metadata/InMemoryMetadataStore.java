package io.github.koszti.segmentstore.metadata;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local metadata store for development and tests.
 */
@Component
@ConditionalOnProperty(prefix = "store.metadata", name = "type", havingValue = "memory")
public class InMemoryMetadataStore implements MetadataStore {

    private final Map<String, FileRecord> files = new HashMap<>();
    private final Map<String, List<SegmentRecord>> segmentsByFile = new HashMap<>();

    @Override
    public synchronized void createFile(FileRecord file) {
        if (files.putIfAbsent(file.id(), file) != null) {
            throw new IllegalStateException("File already exists: " + file.id());
        }
    }

    @Override
    public synchronized void createSegment(SegmentRecord segment) {
        List<SegmentRecord> segments = segmentsByFile.computeIfAbsent(segment.fileId(), k -> new ArrayList<>());
        for (SegmentRecord existing : segments) {
            if (existing.orderIndex() == segment.orderIndex()) {
                throw new IllegalStateException("Duplicate segment " + segment.orderIndex() + " for file " + segment.fileId());
            }
        }
        segments.add(segment);
    }

    @Override
    public synchronized void createFileWithSegments(FileRecord file, List<SegmentRecord> segments) {
        MetadataStore.super.createFileWithSegments(file, segments);
    }

    @Override
    public synchronized Optional<FileRecord> getFile(String fileId) {
        return Optional.ofNullable(files.get(fileId));
    }

    @Override
    public synchronized List<SegmentRecord> getSegments(String fileId) {
        List<SegmentRecord> segments = new ArrayList<>(segmentsByFile.getOrDefault(fileId, List.of()));
        segments.sort(Comparator.comparingInt(SegmentRecord::orderIndex));
        return segments;
    }
}
