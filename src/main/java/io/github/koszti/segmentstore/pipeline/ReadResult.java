package io.github.koszti.segmentstore.pipeline;

import io.github.koszti.segmentstore.metadata.FileRecord;

import java.util.Objects;

/**
 * A fully verified and reassembled file.
 */
public record ReadResult(FileRecord file, byte[] content) {

    /**
     * Largest content a read can return as one array.
     */
    public static final long MAX_CONTENT_SIZE = Integer.MAX_VALUE - 8;

    public ReadResult {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
