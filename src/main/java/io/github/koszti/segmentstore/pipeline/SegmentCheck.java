package io.github.koszti.segmentstore.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.koszti.segmentstore.metadata.SegmentRecord;

/**
 * Outcome of checking one stored segment against its recorded hash.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SegmentCheck(
        @JsonProperty("order_index") int orderIndex,
        @JsonProperty("blob_key") String blobKey,
        @JsonProperty("status") Status status,
        @JsonProperty("expected_hash") String expectedHash,
        @JsonProperty("actual_hash") String actualHash,
        @JsonProperty("size_bytes") Long sizeBytes,
        @JsonProperty("detail") String detail
) {
    public enum Status {
        OK,
        CORRUPT,
        MISSING,
        ERROR
    }

    static SegmentCheck ok(SegmentRecord segment, long size) {
        return new SegmentCheck(segment.orderIndex(), segment.blobKey(), Status.OK, segment.hash(), segment.hash(), size, null);
    }

    static SegmentCheck corrupt(SegmentRecord segment, String actualHash, long size) {
        return new SegmentCheck(segment.orderIndex(), segment.blobKey(), Status.CORRUPT, segment.hash(), actualHash, size,
                "hash mismatch");
    }

    static SegmentCheck missing(SegmentRecord segment) {
        return new SegmentCheck(segment.orderIndex(), segment.blobKey(), Status.MISSING, segment.hash(), null, null,
                "blob not found");
    }

    static SegmentCheck error(SegmentRecord segment, Exception e) {
        return new SegmentCheck(segment.orderIndex(), segment.blobKey(), Status.ERROR, segment.hash(), null, null,
                e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }

    @JsonIgnore
    public boolean isOk() {
        return status == Status.OK;
    }
}
