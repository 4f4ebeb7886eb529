package io.github.koszti.segmentstore.exception;

import java.util.Objects;

/**
 * Stored data does not match its recorded metadata.
 */
public abstract class IntegrityException extends RuntimeException {

    private final String fileId;

    protected IntegrityException(String fileId, String message) {
        super(message);
        this.fileId = Objects.requireNonNull(fileId, "fileId must not be null");
    }

    public String getFileId() {
        return fileId;
    }
}
