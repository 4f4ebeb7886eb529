package io.github.koszti.segmentstore.exception;

/**
 * The file is larger than a single in-memory read can return.
 */
public class FileTooLargeException extends RuntimeException {

    private final String fileId;
    private final long size;
    private final long limit;

    public FileTooLargeException(String fileId, long size, long limit) {
        super("File " + fileId + " is " + size + " bytes, exceeding the limit of " + limit + " bytes");
        this.fileId = fileId;
        this.size = size;
        this.limit = limit;
    }

    public String getFileId() {
        return fileId;
    }

    public long getSize() {
        return size;
    }

    public long getLimit() {
        return limit;
    }
}
