package net.wizeops.tiercache.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lifetime counters of a single provider. Unlike the performance monitor these are never
 * trimmed by retention.
 */
public class CacheStatistics {
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong puts = new AtomicLong();
    private final AtomicLong deletes = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getPuts() {
        return puts.get();
    }

    public long getDeletes() {
        return deletes.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    public long getExpirations() {
        return expirations.get();
    }

    public long getErrors() {
        return errors.get();
    }

    public double getHitRatio() {
        long totalRequests = hits.get() + misses.get();
        return totalRequests == 0 ? 0 : (double) hits.get() / totalRequests;
    }

    public void recordHit() {
        hits.incrementAndGet();
    }

    public void recordMiss() {
        misses.incrementAndGet();
    }

    public void recordPut() {
        puts.incrementAndGet();
    }

    public void recordDelete() {
        deletes.incrementAndGet();
    }

    public void recordEviction() {
        evictions.incrementAndGet();
    }

    public void recordExpiration() {
        expirations.incrementAndGet();
    }

    public void recordBulkDelete(int count) {
        deletes.addAndGet(count);
    }

    public void recordError() {
        errors.incrementAndGet();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("hits", hits.get());
        map.put("misses", misses.get());
        map.put("hitRatio", getHitRatio());
        map.put("puts", puts.get());
        map.put("deletes", deletes.get());
        map.put("evictions", evictions.get());
        map.put("expirations", expirations.get());
        map.put("errors", errors.get());
        return map;
    }
}
