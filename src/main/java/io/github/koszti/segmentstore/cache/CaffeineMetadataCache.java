package io.github.koszti.segmentstore.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.github.koszti.segmentstore.metadata.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Caffeine backed metadata cache with a TTL per entry.
 */
public class CaffeineMetadataCache implements MetadataCache {

    private static final Logger log = LoggerFactory.getLogger(CaffeineMetadataCache.class);

    private record Entry(FileRecord file, Duration ttl) {}

    private final Cache<String, Entry> cache;

    public CaffeineMetadataCache(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    public CaffeineMetadataCache(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry value, long currentTime) {
                        return value.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
                        return value.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .ticker(ticker)
                .build();
    }

    @Override
    public Optional<FileRecord> get(String fileId) {
        Entry entry = cache.getIfPresent(fileId);
        return entry == null ? Optional.empty() : Optional.of(entry.file());
    }

    @Override
    public void put(String fileId, FileRecord file, Duration ttl) {
        Objects.requireNonNull(file, "file must not be null");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        cache.put(fileId, new Entry(file, ttl));
        log.debug("Cached file {} for {}", fileId, ttl);
    }

    @Override
    public void invalidate(String fileId) {
        cache.invalidate(fileId);
    }
}
