package io.github.koszti.segmentstore.blob;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local blob store for development and tests. Contents are lost on restart.
 */
@Component
@ConditionalOnProperty(prefix = "store.blob", name = "type", havingValue = "memory")
public class InMemoryBlobStore implements BlobStore {

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public void put(String key, byte[] data) {
        blobs.put(key, data.clone());
    }

    @Override
    public byte[] get(String key) throws BlobNotFoundException {
        byte[] data = blobs.get(key);
        if (data == null) {
            throw new BlobNotFoundException(key, null);
        }
        return data.clone();
    }

    @Override
    public void delete(String key) {
        blobs.remove(key);
    }

    public boolean contains(String key) {
        return blobs.containsKey(key);
    }

    public Set<String> keys() {
        return Set.copyOf(blobs.keySet());
    }

    public int size() {
        return blobs.size();
    }
}
