package io.github.koszti.segmentstore.api;

import io.github.koszti.segmentstore.api.dto.ErrorResponse;
import io.github.koszti.segmentstore.exception.FileTooLargeException;
import io.github.koszti.segmentstore.exception.IntegrityException;
import io.github.koszti.segmentstore.exception.InvalidWriteRequestException;
import io.github.koszti.segmentstore.exception.SegmentIntegrityException;
import io.github.koszti.segmentstore.exception.StorageDependencyException;
import io.github.koszti.segmentstore.exception.StoredFileNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;

/**
 * Maps pipeline failures to HTTP status codes. Every error carries a JSON {@link ErrorResponse}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidWriteRequestException.class)
    public ResponseEntity<ErrorResponse> invalidRequest(InvalidWriteRequestException e) {
        log.info("Rejected write request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.of("invalid_request", e.getMessage()));
    }

    @ExceptionHandler(StoredFileNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(StoredFileNotFoundException e) {
        log.info("File not found: {}", e.getFileId());
        return respond(HttpStatus.NOT_FOUND,
                new ErrorResponse("not_found", e.getMessage(), e.getFileId(), null, null));
    }

    @ExceptionHandler(IntegrityException.class)
    public ResponseEntity<ErrorResponse> integrity(IntegrityException e) {
        log.error("Integrity check failed for file {}: {}", e.getFileId(), e.getMessage());
        ErrorResponse body;
        if (e instanceof SegmentIntegrityException se) {
            body = new ErrorResponse("integrity_error", e.getMessage(), e.getFileId(), se.getOrderIndex(),
                    se.getBlobKey());
        } else {
            body = new ErrorResponse("integrity_error", e.getMessage(), e.getFileId(), null, null);
        }
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, body);
    }

    @ExceptionHandler(StorageDependencyException.class)
    public ResponseEntity<ErrorResponse> dependency(StorageDependencyException e) {
        log.warn("{} failure: {}", e.getDependency(), e.getMessage(), e);
        String error = e.getDependency() == StorageDependencyException.Dependency.BLOB_STORE
                ? "blob_store_unavailable"
                : "metadata_store_unavailable";
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ErrorResponse.of(error, e.getMessage()));
    }

    @ExceptionHandler(FileTooLargeException.class)
    public ResponseEntity<ErrorResponse> tooLarge(FileTooLargeException e) {
        log.info("Rejected oversized file {}: {} bytes, limit {}", e.getFileId(), e.getSize(), e.getLimit());
        return respond(HttpStatus.PAYLOAD_TOO_LARGE,
                new ErrorResponse("file_too_large", e.getMessage(), e.getFileId(), null, null));
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> inputFailure(IOException e) {
        log.info("Failed to read request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.of("input_error", e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> internalError(IllegalStateException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.of("internal_error", e.getMessage()));
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorResponse body) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
