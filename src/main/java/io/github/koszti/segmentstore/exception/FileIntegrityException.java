package io.github.koszti.segmentstore.exception;

/**
 * File level metadata is inconsistent: segment plan does not match the file record,
 * or the reassembled size differs from the recorded size.
 */
public class FileIntegrityException extends IntegrityException {

    public FileIntegrityException(String fileId, String message) {
        super(fileId, message);
    }
}
