package io.github.koszti.segmentstore.exception;

import java.util.Objects;

public class StorageDependencyException extends RuntimeException {

    public enum Dependency {
        BLOB_STORE,
        METADATA_STORE
    }

    private final Dependency dependency;

    public StorageDependencyException(Dependency dependency, String message, Throwable cause) {
        super(message, cause);
        this.dependency = Objects.requireNonNull(dependency, "dependency must not be null");
    }

    public Dependency getDependency() {
        return dependency;
    }
}
