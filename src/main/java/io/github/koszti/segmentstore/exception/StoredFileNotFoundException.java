package io.github.koszti.segmentstore.exception;

import java.util.Objects;

public class StoredFileNotFoundException extends RuntimeException {

    private final String fileId;

    public StoredFileNotFoundException(String fileId) {
        super("File not found: " + fileId);
        this.fileId = Objects.requireNonNull(fileId, "fileId must not be null");
    }

    public String getFileId() {
        return fileId;
    }
}
