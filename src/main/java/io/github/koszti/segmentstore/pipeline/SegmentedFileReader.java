package io.github.koszti.segmentstore.pipeline;

import io.github.koszti.segmentstore.cache.MetadataCache;
import io.github.koszti.segmentstore.config.StoreCacheProperties;
import io.github.koszti.segmentstore.exception.FileIntegrityException;
import io.github.koszti.segmentstore.exception.FileTooLargeException;
import io.github.koszti.segmentstore.exception.StoredFileNotFoundException;
import io.github.koszti.segmentstore.metadata.FileRecord;
import io.github.koszti.segmentstore.metadata.MetadataStore;
import io.github.koszti.segmentstore.metadata.SegmentRecord;
import io.github.koszti.segmentstore.trace.PipelineSpan;
import io.github.koszti.segmentstore.trace.PipelineTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Read path: cache-aside metadata lookup, parallel verified fetch, ordered reassembly.
 * <p>
 * File records are immutable once committed, so a cache entry populated by a read that raced a
 * write of the same id can only ever hold the committed record. Segment records are never cached.
 */
@Component
public class SegmentedFileReader {

    private static final Logger log = LoggerFactory.getLogger(SegmentedFileReader.class);

    private final MetadataStore metadataStore;
    private final MetadataCache metadataCache;
    private final ParallelSegmentFetcher fetcher;
    private final PipelineTracer tracer;
    private final StoreCacheProperties cacheProps;

    public SegmentedFileReader(MetadataStore metadataStore,
            MetadataCache metadataCache,
            ParallelSegmentFetcher fetcher,
            PipelineTracer tracer,
            StoreCacheProperties cacheProps) {
        this.metadataStore = metadataStore;
        this.metadataCache = metadataCache;
        this.fetcher = fetcher;
        this.tracer = tracer;
        this.cacheProps = cacheProps;
    }

    /**
     * Read and verify the file identified by {@code fileId}.
     *
     * @throws StoredFileNotFoundException if no such file exists
     * @throws FileTooLargeException if the file cannot be returned as a single array
     * @throws io.github.koszti.segmentstore.exception.IntegrityException if any segment or the
     *         assembled file does not match its metadata
     * @throws io.github.koszti.segmentstore.exception.StorageDependencyException if a store fails
     */
    public ReadResult read(String fileId) {
        try (PipelineSpan span = tracer.startSpan("read_file")) {
            span.setAttribute("file_id", fileId);
            log.info("Reading file: {}", fileId);
            try {
                FileRecord file = lookupFile(fileId, span);
                if (file.size() > ReadResult.MAX_CONTENT_SIZE) {
                    throw new FileTooLargeException(fileId, file.size(), ReadResult.MAX_CONTENT_SIZE);
                }
                List<SegmentRecord> plan = segmentPlan(file, span);

                List<byte[]> parts = fetcher.fetchAll(fileId, plan, span);
                byte[] content = reassemble(file, parts, span);

                log.info("File read completed: {} (ID: {}, {} bytes, {} segments)",
                        file.name(), fileId, content.length, plan.size());
                return new ReadResult(file, content);
            } catch (RuntimeException e) {
                span.recordError(e);
                throw e;
            }
        }
    }

    /**
     * Check every stored segment of {@code fileId} without reassembling the file.
     * Individual segment problems are reported, not thrown.
     *
     * @throws StoredFileNotFoundException if no such file exists
     */
    public VerificationReport verify(String fileId) {
        try (PipelineSpan span = tracer.startSpan("verify_file")) {
            span.setAttribute("file_id", fileId);
            FileRecord file = lookupFile(fileId, span);

            List<SegmentRecord> segments;
            try (PipelineSpan dbSpan = span.startChild("fetch_segment_metadata")) {
                segments = metadataStore.getSegments(fileId);
                dbSpan.setAttribute("segment_count", segments.size());
            }

            boolean planConsistent = isContiguous(segments) && segments.size() == file.segmentCount();
            List<SegmentCheck> checks = fetcher.checkAll(fileId, segments, span);
            VerificationReport report = new VerificationReport(fileId, file.segmentCount(), segments.size(),
                    planConsistent, checks);

            if (report.healthy()) {
                log.info("Verified file {}: {} segments ok", fileId, checks.size());
            } else {
                log.warn("Verification of file {} found problems: plan consistent={}, {} failing segment(s)",
                        fileId, planConsistent, report.failures().size());
            }
            span.setAttribute("healthy", report.healthy());
            return report;
        }
    }

    private FileRecord lookupFile(String fileId, PipelineSpan parent) {
        Optional<FileRecord> cached;
        try (PipelineSpan span = parent.startChild("cache_lookup")) {
            cached = cacheGet(fileId, span);
            span.setAttribute("cache_hit", cached.isPresent());
        }
        if (cached.isPresent()) {
            log.debug("Cache hit for file {}", fileId);
            return cached.get();
        }

        FileRecord file;
        try (PipelineSpan span = parent.startChild("db_lookup")) {
            file = metadataStore.getFile(fileId)
                    .orElseThrow(() -> new StoredFileNotFoundException(fileId));
        }
        cachePut(fileId, file);
        return file;
    }

    private Optional<FileRecord> cacheGet(String fileId, PipelineSpan span) {
        try {
            return metadataCache.get(fileId);
        } catch (RuntimeException e) {
            span.recordError(e);
            log.warn("Cache lookup failed for file {}, falling back to metadata store: {}", fileId, e.toString());
            return Optional.empty();
        }
    }

    private void cachePut(String fileId, FileRecord file) {
        try {
            metadataCache.put(fileId, file, cacheProps.getTtl());
        } catch (RuntimeException e) {
            log.warn("Failed to cache metadata of file {}: {}", fileId, e.toString());
        }
    }

    private List<SegmentRecord> segmentPlan(FileRecord file, PipelineSpan parent) {
        try (PipelineSpan span = parent.startChild("fetch_segment_metadata")) {
            List<SegmentRecord> segments = metadataStore.getSegments(file.id());
            span.setAttribute("segment_count", segments.size());

            if (segments.size() != file.segmentCount()) {
                throw new FileIntegrityException(file.id(),
                        "File " + file.id() + " records " + file.segmentCount() + " segments but "
                                + segments.size() + " segment records exist");
            }
            if (!isContiguous(segments)) {
                throw new FileIntegrityException(file.id(),
                        "Segment records of file " + file.id() + " do not cover order indexes 0.."
                                + (segments.size() - 1) + " exactly once");
            }
            return segments;
        }
    }

    private static boolean isContiguous(List<SegmentRecord> segments) {
        for (int i = 0; i < segments.size(); i++) {
            if (segments.get(i).orderIndex() != i) {
                return false;
            }
        }
        return true;
    }

    private static byte[] reassemble(FileRecord file, List<byte[]> parts, PipelineSpan parent) {
        try (PipelineSpan span = parent.startChild("reassemble_segments")) {
            long total = 0;
            for (byte[] part : parts) {
                total += part.length;
            }
            if (total != file.size()) {
                throw new FileIntegrityException(file.id(),
                        "Reassembled size of file " + file.id() + " is " + total + " bytes, expected " + file.size());
            }

            byte[] content = new byte[(int) total];
            int offset = 0;
            for (byte[] part : parts) {
                System.arraycopy(part, 0, content, offset, part.length);
                offset += part.length;
            }
            span.setAttribute("total_size", total);
            return content;
        }
    }
}
