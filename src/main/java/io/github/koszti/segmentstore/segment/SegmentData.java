package io.github.koszti.segmentstore.segment;

import java.util.Objects;

/**
 * One segment produced by the {@link Segmenter}, held in memory until it is uploaded.
 */
public record SegmentData(byte[] data, int orderIndex, String hash, int size) {

    public SegmentData {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(hash, "hash must not be null");
    }
}
