package io.github.koszti.segmentstore.pipeline;

import io.github.koszti.segmentstore.blob.BlobKeys;
import io.github.koszti.segmentstore.config.StoreCacheProperties;
import io.github.koszti.segmentstore.config.StoreFetchProperties;
import io.github.koszti.segmentstore.config.StoreWriteProperties;
import io.github.koszti.segmentstore.exception.FileIntegrityException;
import io.github.koszti.segmentstore.exception.FileTooLargeException;
import io.github.koszti.segmentstore.exception.SegmentIntegrityException;
import io.github.koszti.segmentstore.exception.StoredFileNotFoundException;
import io.github.koszti.segmentstore.metadata.FileRecord;
import io.github.koszti.segmentstore.metadata.SegmentRecord;
import io.github.koszti.segmentstore.segment.IntegrityVerifier;
import io.github.koszti.segmentstore.segment.Segmenter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Write and read through the whole pipeline against in-memory stores.
 */
class SegmentStorePipelineTest {

    private static final int MIB = 1024 * 1024;

    private final ScriptedBlobStore blobStore = new ScriptedBlobStore();
    private final CountingMetadataStore metadataStore = new CountingMetadataStore();
    private final CountingMetadataCache cache = new CountingMetadataCache();
    private final RecordingPipelineTracer tracer = new RecordingPipelineTracer();

    private ExecutorService executor;
    private SegmentedFileWriter writer;
    private SegmentedFileReader reader;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        StoreFetchProperties fetchProps = new StoreFetchProperties();
        fetchProps.setParallelism(4);

        writer = new SegmentedFileWriter(new Segmenter(MIB), blobStore, metadataStore, cache, tracer,
                new StoreWriteProperties());
        reader = new SegmentedFileReader(metadataStore, cache,
                new ParallelSegmentFetcher(blobStore, executor, fetchProps), tracer, new StoreCacheProperties());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void roundTrip_tenMebibytesInTenSegments() throws IOException {
        byte[] content = randomBytes(10 * MIB, 1);

        WriteResult written = writer.write("big.bin", new ByteArrayInputStream(content));

        assertEquals(10, written.segmentCount());
        assertEquals(10_485_760L, written.size());
        assertEquals("big.bin", written.name());

        ReadResult read = reader.read(written.fileId());
        assertEquals(IntegrityVerifier.sha256Hex(content), IntegrityVerifier.sha256Hex(read.content()));
        assertEquals(10, read.file().segmentCount());
        assertEquals("big.bin", read.file().name());
    }

    @Test
    void roundTrip_emptyFileHasNoSegments() throws IOException {
        WriteResult written = writer.write("empty.txt", new ByteArrayInputStream(new byte[0]));

        assertEquals(0, written.segmentCount());
        assertEquals(0, written.size());
        assertEquals(0, blobStore.puts.get());

        ReadResult read = reader.read(written.fileId());
        assertEquals(0, read.content().length);
        assertEquals(0, blobStore.gets.get());
    }

    @Test
    void roundTrip_singleByte() throws IOException {
        WriteResult written = writer.write("one.bin", new ByteArrayInputStream(new byte[] {7}));

        assertEquals(1, written.segmentCount());
        assertEquals(1, written.size());
        List<SegmentRecord> segments = metadataStore.delegate.getSegments(written.fileId());
        assertEquals(1, segments.get(0).size());
        assertEquals(BlobKeys.segmentKey(written.fileId(), 0), segments.get(0).blobKey());

        assertArrayEquals(new byte[] {7}, reader.read(written.fileId()).content());
    }

    @Test
    void roundTrip_lengthsAroundSegmentBoundaries() throws IOException {
        for (int length : new int[] {MIB - 1, MIB, MIB + 1, 3 * MIB + 17}) {
            byte[] content = randomBytes(length, length);
            WriteResult written = writer.write("f-" + length, new ByteArrayInputStream(content));

            assertEquals((length + MIB - 1) / MIB, written.segmentCount(), "segments for " + length);
            assertArrayEquals(content, reader.read(written.fileId()).content(), "content for " + length);
        }
    }

    @Test
    void write_storesSegmentsUnderConventionalKeys() throws IOException {
        WriteResult written = writer.write("keys.bin", new ByteArrayInputStream(randomBytes(2 * MIB + 1, 5)));

        assertEquals(3, blobStore.keys().size());
        for (int i = 0; i < 3; i++) {
            assertTrue(blobStore.keys().contains("segments/" + written.fileId() + "/" + i));
        }
    }

    @Test
    void read_outOfBandCorruptionIsDetected() throws IOException {
        WriteResult written = writer.write("c.bin", new ByteArrayInputStream(randomBytes(3 * MIB, 9)));
        blobStore.corrupt(BlobKeys.segmentKey(written.fileId(), 1));

        SegmentIntegrityException e = assertThrows(SegmentIntegrityException.class,
                () -> reader.read(written.fileId()));

        assertEquals(1, e.getOrderIndex());
        assertEquals(written.fileId(), e.getFileId());
        assertTrue(tracer.failedSpans().contains("read_file"));
    }

    @Test
    void read_secondReadIsServedFromCache() throws IOException {
        WriteResult written = writer.write("cached.bin", new ByteArrayInputStream(randomBytes(1000, 2)));
        assertEquals(1, cache.invalidations.get());

        reader.read(written.fileId());
        assertEquals(1, cache.misses.get());
        assertEquals(1, cache.puts.get());
        assertEquals(Duration.ofMinutes(5), cache.lastTtl);
        assertEquals(1, metadataStore.getFileCalls.get());

        reader.read(written.fileId());
        assertEquals(1, cache.hits.get());
        assertEquals(1, metadataStore.getFileCalls.get());
        assertEquals(2, metadataStore.getSegmentsCalls.get());
    }

    @Test
    void read_cacheOutageFallsBackToMetadataStore() throws IOException {
        byte[] content = randomBytes(5000, 4);
        WriteResult written = writer.write("nocache.bin", new ByteArrayInputStream(content));
        cache.unavailable = true;

        assertArrayEquals(content, reader.read(written.fileId()).content());
        assertArrayEquals(content, reader.read(written.fileId()).content());
        assertEquals(2, metadataStore.getFileCalls.get());
    }

    @Test
    void read_unknownFileMakesNoBlobCalls() {
        StoredFileNotFoundException e = assertThrows(StoredFileNotFoundException.class,
                () -> reader.read("does-not-exist"));

        assertEquals("does-not-exist", e.getFileId());
        assertEquals(0, blobStore.gets.get());
        assertEquals(0, cache.puts.get());
    }

    @Test
    void read_segmentCountMismatchIsIntegrityFailure() {
        metadataStore.createFile(new FileRecord("broken", "b.bin", 10, 2, Instant.EPOCH));
        metadataStore.createSegment(new SegmentRecord("s0", "broken", 0, IntegrityVerifier.sha256Hex(new byte[10]),
                BlobKeys.segmentKey("broken", 0), 10));

        assertThrows(FileIntegrityException.class, () -> reader.read("broken"));
        assertEquals(0, blobStore.gets.get());
    }

    @Test
    void read_fileTooLargeForMemoryIsRejectedBeforeAnyFetch() {
        long gib = 1L << 30;
        metadataStore.createFile(new FileRecord("huge", "h.bin", 3 * gib, 3, Instant.EPOCH));
        for (int i = 0; i < 3; i++) {
            metadataStore.createSegment(new SegmentRecord("h" + i, "huge", i, IntegrityVerifier.sha256Hex(new byte[0]),
                    BlobKeys.segmentKey("huge", i), gib));
        }

        FileTooLargeException e = assertThrows(FileTooLargeException.class, () -> reader.read("huge"));

        assertEquals("huge", e.getFileId());
        assertEquals(3 * gib, e.getSize());
        assertEquals(ReadResult.MAX_CONTENT_SIZE, e.getLimit());
        assertEquals(0, metadataStore.getSegmentsCalls.get());
        assertEquals(0, blobStore.gets.get());
    }

    @Test
    void read_sizeMismatchIsIntegrityFailure() {
        byte[] data = new byte[] {1, 2, 3};
        blobStore.putOutOfBand(BlobKeys.segmentKey("short", 0), data);
        metadataStore.createFile(new FileRecord("short", "s.bin", 4, 1, Instant.EPOCH));
        metadataStore.createSegment(new SegmentRecord("s0", "short", 0, IntegrityVerifier.sha256Hex(data),
                BlobKeys.segmentKey("short", 0), 3));

        FileIntegrityException e = assertThrows(FileIntegrityException.class, () -> reader.read("short"));
        assertTrue(e.getMessage().contains("expected 4"));
    }

    @Test
    void verify_reportsHealthyFile() throws IOException {
        WriteResult written = writer.write("v.bin", new ByteArrayInputStream(randomBytes(2 * MIB, 11)));

        VerificationReport report = reader.verify(written.fileId());

        assertTrue(report.healthy());
        assertTrue(report.planConsistent());
        assertEquals(2, report.expectedSegments());
        assertEquals(2, report.segments().size());
        assertTrue(report.failures().isEmpty());
    }

    @Test
    void verify_listsCorruptAndMissingSegments() throws IOException {
        WriteResult written = writer.write("v.bin", new ByteArrayInputStream(randomBytes(3 * MIB, 12)));
        blobStore.corrupt(BlobKeys.segmentKey(written.fileId(), 0));
        blobStore.removeOutOfBand(BlobKeys.segmentKey(written.fileId(), 2));

        VerificationReport report = reader.verify(written.fileId());

        assertFalse(report.healthy());
        assertTrue(report.planConsistent());
        assertEquals(2, report.failures().size());
        assertEquals(SegmentCheck.Status.CORRUPT, report.segments().get(0).status());
        assertEquals(SegmentCheck.Status.MISSING, report.segments().get(2).status());
    }

    @Test
    void spans_coverWriteAndReadSteps() throws IOException {
        WriteResult written = writer.write("t.bin", new ByteArrayInputStream(randomBytes(10, 3)));
        reader.read(written.fileId());

        assertTrue(tracer.startedSpans().containsAll(List.of(
                "write_file", "upload_segments", "segment_stream", "save_metadata", "invalidate_cache",
                "read_file", "cache_lookup", "db_lookup", "fetch_segment_metadata", "fetch_segments_parallel",
                "download_segment_0", "reassemble_segments")));
        assertTrue(tracer.failedSpans().isEmpty());
    }

    private static byte[] randomBytes(int length, long seed) {
        byte[] bytes = new byte[length];
        new Random(seed).nextBytes(bytes);
        return bytes;
    }
}
