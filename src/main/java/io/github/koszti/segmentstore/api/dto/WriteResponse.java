package io.github.koszti.segmentstore.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.koszti.segmentstore.pipeline.WriteResult;

/**
 * Body of a successful {@code PUT /write}.
 */
public record WriteResponse(
        @JsonProperty("file_id") String fileId,
        @JsonProperty("file_name") String fileName,
        @JsonProperty("file_size") long fileSize,
        @JsonProperty("segment_count") int segmentCount,
        @JsonProperty("message") String message
) {
    public static WriteResponse from(WriteResult result) {
        return new WriteResponse(result.fileId(), result.name(), result.size(), result.segmentCount(),
                "File uploaded successfully");
    }
}
