package com.namingtool.service.validation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed store of existence checks with a TTL per entry.
 *
 * <p>Keys are plain strings; callers group entries under a prefix so that
 * {@link #invalidatePrefix(String)} can drop a whole family at once.
 */
@Slf4j
@Component
public class ValidationResultCache {

    private static final long MAX_ENTRIES = 10_000;

    private final Cache<String, Entry> cache;

    @Autowired
    public ValidationResultCache() {
        this(Ticker.systemTicker());
    }

    ValidationResultCache(Ticker ticker) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(MAX_ENTRIES)
            .ticker(ticker)
            .expireAfter(new Expiry<String, Entry>() {
                @Override
                public long expireAfterCreate(String key, Entry entry, long currentTime) {
                    return entry.ttl().toNanos();
                }

                @Override
                public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                    return entry.ttl().toNanos();
                }

                @Override
                public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                    return currentDuration;
                }
            })
            .build();
    }

    public Optional<ExistenceCheck> get(String key) {
        Entry entry = cache.getIfPresent(key);
        if (entry == null) {
            log.debug("Validation cache miss: {}", key);
            return Optional.empty();
        }
        log.debug("Validation cache hit: {}", key);
        return Optional.of(entry.value());
    }

    public void put(String key, ExistenceCheck value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        cache.put(key, new Entry(value, ttl));
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    public void invalidatePrefix(String prefix) {
        cache.asMap().keySet().removeIf(key -> key.startsWith(prefix));
        log.debug("Validation cache entries invalidated for prefix: {}", prefix);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record Entry(ExistenceCheck value, Duration ttl) {
    }
}
