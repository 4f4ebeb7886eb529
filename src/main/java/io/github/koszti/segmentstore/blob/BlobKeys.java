package io.github.koszti.segmentstore.blob;

import java.util.Objects;

public final class BlobKeys {
    private BlobKeys() {}

    static final String SEGMENTS_PREFIX = "segments/";

    /**
     * Key of one segment: {@code segments/{fileId}/{orderIndex}}.
     * Existing stored data depends on this layout; do not change it.
     */
    public static String segmentKey(String fileId, int orderIndex) {
        Objects.requireNonNull(fileId, "fileId must not be null");
        if (orderIndex < 0) {
            throw new IllegalArgumentException("orderIndex must not be negative: " + orderIndex);
        }
        return SEGMENTS_PREFIX + fileId + "/" + orderIndex;
    }
}
