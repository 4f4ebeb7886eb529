package io.github.koszti.segmentstore.segment;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a byte stream into consecutive fixed-size segments, each hashed independently.
 * <p>
 * The segment size is an operational constant of the deployment: every file is written
 * with the same value, and already written files keep their own boundaries.
 */
public class Segmenter {

    private final int segmentSize;

    public Segmenter(int segmentSize) {
        if (segmentSize <= 0) {
            throw new IllegalArgumentException("segmentSize must be positive: " + segmentSize);
        }
        this.segmentSize = segmentSize;
    }

    public int getSegmentSize() {
        return segmentSize;
    }

    /**
     * Returns a lazy, single-pass stream of segments over {@code input}.
     * The caller owns {@code input} and closes it.
     */
    public SegmentStream split(InputStream input) {
        Objects.requireNonNull(input, "input must not be null");
        return new SegmentStream(input, segmentSize);
    }

    /**
     * Reads {@code input} to exhaustion and returns every segment in order.
     */
    public Segmentation splitAll(InputStream input) throws IOException {
        SegmentStream stream = split(input);
        List<SegmentData> segments = new ArrayList<>();
        SegmentData segment;
        while ((segment = stream.next()) != null) {
            segments.add(segment);
        }
        return new Segmentation(segments, stream.getTotalSize());
    }

    public record Segmentation(List<SegmentData> segments, long totalSize) {
        public Segmentation {
            segments = List.copyOf(segments);
        }
    }
}
