package io.github.koszti.segmentstore.segment;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SegmenterTest {

    @Test
    void splitAll_returnsNoSegmentsForEmptyInput() throws IOException {
        Segmenter.Segmentation result = new Segmenter(1024).splitAll(new ByteArrayInputStream(new byte[0]));

        assertTrue(result.segments().isEmpty());
        assertEquals(0, result.totalSize());
    }

    @Test
    void splitAll_returnsOneShortSegmentForSingleByte() throws IOException {
        Segmenter.Segmentation result = new Segmenter(1024 * 1024).splitAll(new ByteArrayInputStream(new byte[] {42}));

        assertEquals(1, result.segments().size());
        SegmentData only = result.segments().get(0);
        assertEquals(0, only.orderIndex());
        assertEquals(1, only.size());
        assertArrayEquals(new byte[] {42}, only.data());
        assertEquals(IntegrityVerifier.sha256Hex(new byte[] {42}), only.hash());
    }

    @Test
    void splitAll_segmentCountIsCeilingOfLengthOverSegmentSize() throws IOException {
        int segmentSize = 100;
        Segmenter segmenter = new Segmenter(segmentSize);

        for (int length : new int[] {1, 99, 100, 101, 199, 200, 201, 1000, 1001}) {
            Segmenter.Segmentation result = segmenter.splitAll(new ByteArrayInputStream(randomBytes(length, length)));

            int expected = (length + segmentSize - 1) / segmentSize;
            assertEquals(expected, result.segments().size(), "segment count for length " + length);
            assertEquals(length, result.totalSize());
        }
    }

    @Test
    void splitAll_onlyLastSegmentMayBeShort() throws IOException {
        Segmenter.Segmentation result = new Segmenter(64).splitAll(new ByteArrayInputStream(randomBytes(64 * 3 + 10, 7)));

        assertEquals(4, result.segments().size());
        for (int i = 0; i < 3; i++) {
            assertEquals(64, result.segments().get(i).size());
            assertEquals(i, result.segments().get(i).orderIndex());
        }
        assertEquals(10, result.segments().get(3).size());
    }

    @Test
    void splitAll_concatenationOfSegmentsEqualsInput() throws IOException {
        byte[] input = randomBytes(10_000, 3);
        Segmenter.Segmentation result = new Segmenter(999).splitAll(new ByteArrayInputStream(input));

        ByteArrayOutputStream joined = new ByteArrayOutputStream();
        for (SegmentData segment : result.segments()) {
            assertEquals(IntegrityVerifier.sha256Hex(segment.data()), segment.hash());
            joined.write(segment.data());
        }
        assertArrayEquals(input, joined.toByteArray());
    }

    @Test
    void split_fillsSegmentsFromStreamsThatReturnShortReads() throws IOException {
        byte[] input = "abcdefghijklmnopqrstuvwxyz".getBytes(StandardCharsets.US_ASCII);
        InputStream trickle = new ByteArrayInputStream(input) {
            @Override
            public synchronized int read(byte[] b, int off, int len) {
                return super.read(b, off, Math.min(len, 3));
            }
        };

        Segmenter.Segmentation result = new Segmenter(10).splitAll(trickle);

        assertEquals(3, result.segments().size());
        assertEquals(10, result.segments().get(0).size());
        assertEquals(10, result.segments().get(1).size());
        assertEquals(6, result.segments().get(2).size());
    }

    @Test
    void split_returnsNullAfterExhaustion() throws IOException {
        SegmentStream stream = new Segmenter(4).split(new ByteArrayInputStream(new byte[] {1, 2, 3, 4}));

        SegmentData first = stream.next();
        assertEquals(4, first.size());
        assertNull(stream.next());
        assertNull(stream.next());
        assertTrue(stream.isExhausted());
        assertEquals(1, stream.getSegmentCount());
        assertEquals(4, stream.getTotalSize());
    }

    @Test
    void split_propagatesInputFailureAndRefusesFurtherReads() throws IOException {
        InputStream failing = new InputStream() {
            private int served;

            @Override
            public int read() throws IOException {
                if (served >= 5) {
                    throw new IOException("connection reset");
                }
                return served++;
            }
        };
        SegmentStream stream = new Segmenter(5).split(failing);

        assertEquals(5, stream.next().size());
        IOException e = assertThrows(IOException.class, stream::next);
        assertTrue(e.getMessage().contains("segment 1"));
        assertTrue(e.getMessage().contains("connection reset"));
        assertThrows(IllegalStateException.class, stream::next);
    }

    @Test
    void constructor_rejectsNonPositiveSegmentSize() {
        assertThrows(IllegalArgumentException.class, () -> new Segmenter(0));
        assertThrows(IllegalArgumentException.class, () -> new Segmenter(-1));
    }

    private static byte[] randomBytes(int length, long seed) {
        byte[] bytes = new byte[length];
        new Random(seed).nextBytes(bytes);
        return bytes;
    }
}
