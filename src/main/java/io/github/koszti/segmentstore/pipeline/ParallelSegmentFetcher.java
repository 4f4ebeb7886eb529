package io.github.koszti.segmentstore.pipeline;

import io.github.koszti.segmentstore.blob.BlobNotFoundException;
import io.github.koszti.segmentstore.blob.BlobStore;
import io.github.koszti.segmentstore.config.StoreFetchProperties;
import io.github.koszti.segmentstore.exception.FileIntegrityException;
import io.github.koszti.segmentstore.exception.SegmentIntegrityException;
import io.github.koszti.segmentstore.exception.StorageDependencyException;
import io.github.koszti.segmentstore.metadata.SegmentRecord;
import io.github.koszti.segmentstore.segment.IntegrityVerifier;
import io.github.koszti.segmentstore.trace.PipelineSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Fetches and verifies all segments of a file in parallel.
 * <p>
 * Work runs on the shared fetch executor, with at most {@code store.fetch.max-in-flight-segments}
 * fetches of one read in flight at a time. Each result is stored in the slot addressed by its
 * order index, so completion order never affects the assembled output. On the first failed
 * fetch no further work is issued, in-flight siblings are cancelled and the failure is rethrown.
 */
@Component
public class ParallelSegmentFetcher {

    private static final Logger log = LoggerFactory.getLogger(ParallelSegmentFetcher.class);

    private final BlobStore blobStore;
    private final ExecutorService fetchExecutor;
    private final StoreFetchProperties fetchProps;

    public ParallelSegmentFetcher(BlobStore blobStore,
            ExecutorService segmentFetchExecutor,
            StoreFetchProperties fetchProps) {
        this.blobStore = blobStore;
        this.fetchExecutor = segmentFetchExecutor;
        this.fetchProps = fetchProps;
    }

    private record Slot<T>(int index, T value) {}

    @FunctionalInterface
    private interface SegmentTask<T> {
        T run(SegmentRecord segment, PipelineSpan span) throws Exception;
    }

    /**
     * Fetch every segment of {@code plan} and verify it against its recorded hash.
     *
     * @param plan segment records ordered by order index, with {@code plan.get(i).orderIndex() == i}
     * @return segment bytes, element {@code i} holding the bytes of order index {@code i}
     */
    public List<byte[]> fetchAll(String fileId, List<SegmentRecord> plan, PipelineSpan parentSpan) {
        for (int i = 0; i < plan.size(); i++) {
            if (plan.get(i).orderIndex() != i) {
                throw new FileIntegrityException(fileId,
                        "Segment plan of file " + fileId + " has order index " + plan.get(i).orderIndex()
                                + " at position " + i);
            }
        }

        try (PipelineSpan span = parentSpan.startChild("fetch_segments_parallel")) {
            span.setAttribute("segment_count", plan.size());
            span.setAttribute("max_in_flight", fetchProps.getMaxInFlightSegments());
            try {
                List<byte[]> slots = runWindowed(fileId, plan, span, this::fetchAndVerify);
                span.setAttribute("all_segments_fetched", true);
                return slots;
            } catch (RuntimeException e) {
                span.recordError(e);
                throw e;
            }
        }
    }

    /**
     * Check every segment of {@code plan} without stopping at the first problem.
     * Used for diagnostics; never throws for individual segment failures.
     */
    public List<SegmentCheck> checkAll(String fileId, List<SegmentRecord> plan, PipelineSpan parentSpan) {
        try (PipelineSpan span = parentSpan.startChild("check_segments_parallel")) {
            span.setAttribute("segment_count", plan.size());
            return runWindowed(fileId, plan, span, this::check);
        }
    }

    private byte[] fetchAndVerify(SegmentRecord segment, PipelineSpan span) {
        byte[] data;
        try {
            data = blobStore.get(segment.blobKey());
        } catch (IOException e) {
            throw new StorageDependencyException(StorageDependencyException.Dependency.BLOB_STORE,
                    "Failed to download segment " + segment.orderIndex() + " of file " + segment.fileId()
                            + " (key=" + segment.blobKey() + "): " + e.getMessage(), e);
        }
        span.setAttribute("size_bytes", data.length);

        String actualHash = IntegrityVerifier.sha256Hex(data);
        if (!actualHash.equals(segment.hash())) {
            throw new SegmentIntegrityException(segment.fileId(), segment.orderIndex(), segment.blobKey(),
                    segment.hash(), actualHash);
        }
        span.setAttribute("download_success", true);
        return data;
    }

    private SegmentCheck check(SegmentRecord segment, PipelineSpan span) throws InterruptedException {
        try {
            byte[] data = blobStore.get(segment.blobKey());
            String actualHash = IntegrityVerifier.sha256Hex(data);
            if (actualHash.equals(segment.hash())) {
                return SegmentCheck.ok(segment, data.length);
            }
            span.setAttribute("hash_mismatch", true);
            return SegmentCheck.corrupt(segment, actualHash, data.length);
        } catch (BlobNotFoundException e) {
            return SegmentCheck.missing(segment);
        } catch (IOException | RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Interrupted while checking segment " + segment.orderIndex());
            }
            log.debug("Check of segment {} of file {} failed: {}", segment.orderIndex(), segment.fileId(), e.toString());
            return SegmentCheck.error(segment, e);
        }
    }

    private <T> List<T> runWindowed(String fileId,
            List<SegmentRecord> plan,
            PipelineSpan span,
            SegmentTask<T> task) {
        int total = plan.size();
        List<T> slots = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            slots.add(null);
        }
        if (total == 0) {
            return slots;
        }

        int maxInFlight = fetchProps.getMaxInFlightSegments();
        ExecutorCompletionService<Slot<T>> completionService = new ExecutorCompletionService<>(fetchExecutor);
        List<Future<Slot<T>>> futures = new ArrayList<>(total);

        int submitted = 0;
        int completed = 0;
        try {
            while (completed < total) {
                // Keep the window full; nothing new is issued once a failure has been observed.
                while (submitted < total && submitted - completed < maxInFlight) {
                    final int index = submitted++;
                    final SegmentRecord segment = plan.get(index);
                    futures.add(completionService.submit(() -> runUnit(fileId, index, segment, span, task)));
                }

                Future<Slot<T>> done = completionService.take();
                completed++;
                Slot<T> slot = done.get();
                slots.set(slot.index(), slot.value());
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while fetching segments of file " + fileId, e);
        } catch (ExecutionException e) {
            int cancelled = cancelAll(futures);
            log.warn("Segment fetch for file {} failed after {}/{} completions; cancelled {} in-flight, skipped {}",
                    fileId, completed, total, cancelled, total - submitted);
            throw propagate(fileId, e.getCause());
        }

        log.debug("Fetched {} segments of file {}", total, fileId);
        return slots;
    }

    private static <T> Slot<T> runUnit(String fileId,
            int index,
            SegmentRecord segment,
            PipelineSpan parent,
            SegmentTask<T> task) throws Exception {
        try (PipelineSpan unitSpan = parent.startChild("download_segment_" + segment.orderIndex())) {
            unitSpan.setAttribute("segment_index", segment.orderIndex());
            unitSpan.setAttribute("object_key", segment.blobKey());
            unitSpan.setAttribute("segment_size", segment.size());
            try {
                return new Slot<>(index, task.run(segment, unitSpan));
            } catch (Exception e) {
                unitSpan.recordError(e);
                log.debug("Segment {} of file {} failed: {}", segment.orderIndex(), fileId, e.toString());
                throw e;
            }
        }
    }

    private static <T> int cancelAll(List<Future<Slot<T>>> futures) {
        int cancelled = 0;
        for (Future<Slot<T>> future : futures) {
            if (!future.isDone() && future.cancel(true)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    private static RuntimeException propagate(String fileId, Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new StorageDependencyException(StorageDependencyException.Dependency.BLOB_STORE,
                "Segment fetch failed for file " + fileId + ": " + cause, cause);
    }
}
