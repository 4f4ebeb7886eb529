package io.github.koszti.segmentstore.pipeline;

import io.github.koszti.segmentstore.blob.BlobKeys;
import io.github.koszti.segmentstore.blob.BlobStore;
import io.github.koszti.segmentstore.cache.MetadataCache;
import io.github.koszti.segmentstore.config.StoreWriteProperties;
import io.github.koszti.segmentstore.exception.FileTooLargeException;
import io.github.koszti.segmentstore.exception.InvalidWriteRequestException;
import io.github.koszti.segmentstore.exception.StorageDependencyException;
import io.github.koszti.segmentstore.metadata.FileRecord;
import io.github.koszti.segmentstore.metadata.MetadataStore;
import io.github.koszti.segmentstore.metadata.SegmentRecord;
import io.github.koszti.segmentstore.segment.SegmentData;
import io.github.koszti.segmentstore.segment.SegmentStream;
import io.github.koszti.segmentstore.segment.Segmenter;
import io.github.koszti.segmentstore.trace.PipelineSpan;
import io.github.koszti.segmentstore.trace.PipelineTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Write path: segment the input, upload each segment, commit metadata, invalidate the cache.
 * <p>
 * The write is two-phase. All blobs are uploaded first; metadata is committed only after every
 * upload succeeded. If anything fails before the commit, the blobs uploaded by this write are
 * deleted (best effort, see {@code store.write.cleanup-on-failure}) and the failure is rethrown.
 */
@Component
public class SegmentedFileWriter {

    private static final Logger log = LoggerFactory.getLogger(SegmentedFileWriter.class);

    /**
     * Width of the {@code files.name} column.
     */
    static final int MAX_NAME_LENGTH = 255;

    private final Segmenter segmenter;
    private final BlobStore blobStore;
    private final MetadataStore metadataStore;
    private final MetadataCache metadataCache;
    private final PipelineTracer tracer;
    private final StoreWriteProperties writeProps;

    public SegmentedFileWriter(Segmenter segmenter,
            BlobStore blobStore,
            MetadataStore metadataStore,
            MetadataCache metadataCache,
            PipelineTracer tracer,
            StoreWriteProperties writeProps) {
        this.segmenter = segmenter;
        this.blobStore = blobStore;
        this.metadataStore = metadataStore;
        this.metadataCache = metadataCache;
        this.tracer = tracer;
        this.writeProps = writeProps;
    }

    /**
     * Store the content of {@code input} as a new file named {@code name}.
     * The caller owns {@code input}.
     *
     * @throws InvalidWriteRequestException if {@code name} is missing, blank or too long
     * @throws FileTooLargeException        if the content exceeds {@code store.write.max-file-size-bytes}
     * @throws IOException                  if reading {@code input} fails
     * @throws StorageDependencyException   if the blob store or metadata store fails
     */
    public WriteResult write(String name, InputStream input) throws IOException {
        if (name == null || name.isBlank()) {
            throw new InvalidWriteRequestException("File name must not be empty");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new InvalidWriteRequestException(
                    "File name must not exceed " + MAX_NAME_LENGTH + " characters, got " + name.length());
        }
        if (input == null) {
            throw new InvalidWriteRequestException("File content must not be null");
        }

        String fileId = UUID.randomUUID().toString();
        PipelineSpan span = tracer.startSpan("write_file")
                .setAttribute("file_name", name)
                .setAttribute("file_id", fileId);

        log.info("Writing file: {} (ID: {})", name, fileId);

        List<String> uploadedKeys = new ArrayList<>();
        try {
            List<SegmentRecord> segments = uploadSegments(fileId, input, uploadedKeys, span);

            long totalSize = 0;
            for (SegmentRecord segment : segments) {
                totalSize += segment.size();
            }
            span.setAttribute("file_size", totalSize)
                    .setAttribute("segment_count", segments.size());

            FileRecord file = new FileRecord(fileId, name, totalSize, segments.size(),
                    Instant.now().truncatedTo(ChronoUnit.MILLIS));
            saveMetadata(file, segments, span);

            invalidateCache(fileId, span);

            log.info("File write completed: {} (ID: {}, {} bytes, {} segments)",
                    name, fileId, totalSize, segments.size());
            return new WriteResult(fileId, name, totalSize, segments.size());
        } catch (IOException | RuntimeException e) {
            span.recordError(e);
            compensate(fileId, uploadedKeys, e);
            throw e;
        } finally {
            span.close();
        }
    }

    private List<SegmentRecord> uploadSegments(String fileId,
            InputStream input,
            List<String> uploadedKeys,
            PipelineSpan parent) throws IOException {
        try (PipelineSpan span = parent.startChild("upload_segments");
                PipelineSpan streamSpan = span.startChild("segment_stream")) {
            SegmentStream stream = segmenter.split(input);
            streamSpan.setAttribute("segment_size", segmenter.getSegmentSize());
            List<SegmentRecord> records = new ArrayList<>();
            long maxFileSize = writeProps.getMaxFileSizeBytes();
            long written = 0;

            SegmentData segment;
            while ((segment = nextSegment(stream, streamSpan)) != null) {
                written += segment.size();
                if (written > maxFileSize) {
                    throw new FileTooLargeException(fileId, written, maxFileSize);
                }
                String key = BlobKeys.segmentKey(fileId, segment.orderIndex());
                // Tracked before the upload: a failed put may still leave a partial object behind.
                uploadedKeys.add(key);
                try {
                    blobStore.put(key, segment.data());
                } catch (IOException e) {
                    throw new StorageDependencyException(StorageDependencyException.Dependency.BLOB_STORE,
                            "Failed to upload segment " + segment.orderIndex() + " of file " + fileId
                                    + " (key=" + key + "): " + e.getMessage(), e);
                }

                records.add(new SegmentRecord(
                        UUID.randomUUID().toString(),
                        fileId,
                        segment.orderIndex(),
                        segment.hash(),
                        key,
                        segment.size()));
                log.debug("Uploaded segment {} of file {} ({} bytes)", segment.orderIndex(), fileId, segment.size());
            }

            streamSpan.setAttribute("bytes_read", stream.getTotalSize());
            span.setAttribute("segments_uploaded", records.size());
            return records;
        }
    }

    private static SegmentData nextSegment(SegmentStream stream, PipelineSpan span) throws IOException {
        try {
            return stream.next();
        } catch (IOException e) {
            span.recordError(e);
            throw e;
        }
    }

    private void saveMetadata(FileRecord file, List<SegmentRecord> segments, PipelineSpan parent) {
        try (PipelineSpan span = parent.startChild("save_metadata")) {
            try {
                metadataStore.createFileWithSegments(file, segments);
            } catch (RuntimeException e) {
                span.recordError(e);
                throw e;
            }
            span.setAttribute("metadata_saved", true);
        }
    }

    private void invalidateCache(String fileId, PipelineSpan parent) {
        try (PipelineSpan span = parent.startChild("invalidate_cache")) {
            try {
                metadataCache.invalidate(fileId);
            } catch (RuntimeException e) {
                // The write has been committed; a stale entry only costs a cache miss later.
                span.recordError(e);
                log.warn("Failed to invalidate cache for file {}: {}", fileId, e.toString());
            }
        }
    }

    private void compensate(String fileId, List<String> uploadedKeys, Exception failure) {
        if (uploadedKeys.isEmpty()) {
            return;
        }
        if (!writeProps.isCleanupOnFailure()) {
            log.warn("Write of file {} failed; leaving {} uploaded blob(s) in place (cleanup disabled)",
                    fileId, uploadedKeys.size());
            return;
        }

        int deleted = 0;
        for (String key : uploadedKeys) {
            try {
                blobStore.delete(key);
                deleted++;
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to delete orphaned blob {} of failed write {}: {}", key, fileId, e.toString());
                failure.addSuppressed(e);
            }
        }
        log.info("Cleaned up {}/{} blob(s) of failed write {}", deleted, uploadedKeys.size(), fileId);
    }
}
