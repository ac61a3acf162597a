package net.wizeops.tiercache.core;

import lombok.Getter;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A value held by the memory tier together with its expiry and access bookkeeping.
 * Times are epoch milliseconds taken from the owning provider's clock.
 */
@Getter
public class CacheEntry {
    private final Object value;
    private final long createdAt;
    private final long expirationTime;
    private final long sizeBytes;
    private final CacheTier tier;
    private final AtomicLong lastAccessTime;
    private final AtomicInteger accessCount;

    public CacheEntry(Object value, long createdAt, long expirationTime, long sizeBytes, CacheTier tier) {
        this.value = value;
        this.createdAt = createdAt;
        this.expirationTime = expirationTime;
        this.sizeBytes = sizeBytes;
        this.tier = tier;
        this.lastAccessTime = new AtomicLong(createdAt);
        this.accessCount = new AtomicInteger(0);
    }

    public boolean isExpired(long now) {
        return now >= expirationTime;
    }

    public void recordAccess(long now) {
        lastAccessTime.set(now);
        accessCount.incrementAndGet();
    }
}
