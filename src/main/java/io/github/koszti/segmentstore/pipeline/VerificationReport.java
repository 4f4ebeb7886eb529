package io.github.koszti.segmentstore.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of {@link SegmentedFileReader#verify(String)}.
 *
 * @param planConsistent true when the segment records form exactly {@code [0, expectedSegments)}
 */
public record VerificationReport(
        @JsonProperty("file_id") String fileId,
        @JsonProperty("expected_segments") int expectedSegments,
        @JsonProperty("recorded_segments") int recordedSegments,
        @JsonProperty("plan_consistent") boolean planConsistent,
        @JsonProperty("segments") List<SegmentCheck> segments
) {
    public VerificationReport {
        segments = List.copyOf(segments);
    }

    @JsonProperty("healthy")
    public boolean healthy() {
        return planConsistent && segments.stream().allMatch(SegmentCheck::isOk);
    }

    public List<SegmentCheck> failures() {
        return segments.stream().filter(s -> !s.isOk()).toList();
    }
}
