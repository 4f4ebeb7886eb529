package io.github.koszti.segmentstore.pipeline;

import io.github.koszti.segmentstore.cache.CaffeineMetadataCache;
import io.github.koszti.segmentstore.cache.MetadataCache;
import io.github.koszti.segmentstore.metadata.FileRecord;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

class CountingMetadataCache implements MetadataCache {

    private final CaffeineMetadataCache delegate = new CaffeineMetadataCache(100);

    final AtomicInteger hits = new AtomicInteger();
    final AtomicInteger misses = new AtomicInteger();
    final AtomicInteger puts = new AtomicInteger();
    final AtomicInteger invalidations = new AtomicInteger();

    volatile boolean unavailable;
    volatile Duration lastTtl;

    @Override
    public Optional<FileRecord> get(String fileId) {
        failIfUnavailable();
        Optional<FileRecord> file = delegate.get(fileId);
        (file.isPresent() ? hits : misses).incrementAndGet();
        return file;
    }

    @Override
    public void put(String fileId, FileRecord file, Duration ttl) {
        failIfUnavailable();
        puts.incrementAndGet();
        lastTtl = ttl;
        delegate.put(fileId, file, ttl);
    }

    @Override
    public void invalidate(String fileId) {
        failIfUnavailable();
        invalidations.incrementAndGet();
        delegate.invalidate(fileId);
    }

    private void failIfUnavailable() {
        if (unavailable) {
            throw new IllegalStateException("cache unavailable");
        }
    }
}
