package io.github.koszti.segmentstore.blob;

import java.io.IOException;

public class BlobNotFoundException extends IOException {

    private final String key;

    public BlobNotFoundException(String key, Throwable cause) {
        super("Blob not found: " + key, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
