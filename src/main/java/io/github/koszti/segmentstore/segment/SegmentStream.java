package io.github.koszti.segmentstore.segment;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

/**
 * Single-pass iterator over the segments of an input stream.
 * Not restartable: once the input is consumed (or failed), {@link #next()} keeps returning null
 * or fails, and re-splitting requires a fresh stream.
 */
public final class SegmentStream {

    private final InputStream input;
    private final int segmentSize;

    private int nextOrderIndex;
    private long totalSize;
    private boolean exhausted;
    private boolean failed;

    SegmentStream(InputStream input, int segmentSize) {
        this.input = input;
        this.segmentSize = segmentSize;
    }

    /**
     * Reads the next segment.
     *
     * @return the next segment, or {@code null} once the input is exhausted
     * @throws IOException if the underlying stream fails before exhaustion
     */
    public SegmentData next() throws IOException {
        if (failed) {
            throw new IllegalStateException("Segment stream already failed; re-split from a fresh stream");
        }
        if (exhausted) {
            return null;
        }

        byte[] buffer = new byte[segmentSize];
        int read;
        try {
            read = input.readNBytes(buffer, 0, segmentSize);
        } catch (IOException e) {
            failed = true;
            throw new IOException("Failed to read segment " + nextOrderIndex + " from input: " + e.getMessage(), e);
        }

        // A short read means end of input; the final segment may be shorter but never empty.
        if (read < segmentSize) {
            exhausted = true;
        }
        if (read == 0) {
            return null;
        }

        byte[] data = read == segmentSize ? buffer : Arrays.copyOf(buffer, read);
        SegmentData segment = new SegmentData(data, nextOrderIndex, IntegrityVerifier.sha256Hex(data), read);
        nextOrderIndex++;
        totalSize += read;
        return segment;
    }

    public long getTotalSize() {
        return totalSize;
    }

    public int getSegmentCount() {
        return nextOrderIndex;
    }

    public boolean isExhausted() {
        return exhausted;
    }
}
