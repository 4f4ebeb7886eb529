package io.github.koszti.segmentstore.exception;

public class InvalidWriteRequestException extends RuntimeException {

    public InvalidWriteRequestException(String message) {
        super(message);
    }
}
