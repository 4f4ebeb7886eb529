package io.github.koszti.segmentstore.blob;

import java.io.IOException;

/**
 * Abstraction over where segment bytes live (S3, MinIO, memory).
 * Calls are blocking and independent; implementations do no client-side locking.
 */
public interface BlobStore
{
    /**
     * Store {@code data} under {@code key}, replacing any existing object.
     */
    void put(String key, byte[] data) throws IOException;

    /**
     * Read all bytes stored under {@code key}.
     *
     * @throws BlobNotFoundException if nothing is stored under {@code key}
     */
    byte[] get(String key) throws IOException;

    /**
     * Delete the object under {@code key}. Deleting a missing key is not an error.
     */
    void delete(String key) throws IOException;
}
