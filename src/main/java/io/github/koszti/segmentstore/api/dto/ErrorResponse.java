package io.github.koszti.segmentstore.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by every endpoint. {@code segment_index} and {@code blob_key}
 * are only present for segment integrity failures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        @JsonProperty("error") String error,
        @JsonProperty("message") String message,
        @JsonProperty("file_id") String fileId,
        @JsonProperty("segment_index") Integer segmentIndex,
        @JsonProperty("blob_key") String blobKey
) {
    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, null, null, null);
    }
}
