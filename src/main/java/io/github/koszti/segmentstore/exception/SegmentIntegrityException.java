package io.github.koszti.segmentstore.exception;

public class SegmentIntegrityException extends IntegrityException {

    private final int orderIndex;
    private final String blobKey;
    private final String expectedHash;
    private final String actualHash;

    public SegmentIntegrityException(String fileId,
            int orderIndex,
            String blobKey,
            String expectedHash,
            String actualHash) {
        super(fileId, "Hash mismatch for segment " + orderIndex + " of file " + fileId
                + " (key=" + blobKey + ", expected=" + expectedHash + ", actual=" + actualHash + ")");
        this.orderIndex = orderIndex;
        this.blobKey = blobKey;
        this.expectedHash = expectedHash;
        this.actualHash = actualHash;
    }

    public int getOrderIndex() {
        return orderIndex;
    }

    public String getBlobKey() {
        return blobKey;
    }

    public String getExpectedHash() {
        return expectedHash;
    }

    public String getActualHash() {
        return actualHash;
    }
}
