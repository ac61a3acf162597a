package net.wizeops.tiercache.providers.memory;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.wizeops.tiercache.api.CacheProvider;
import net.wizeops.tiercache.config.CacheConfig;
import net.wizeops.tiercache.core.CacheEntry;
import net.wizeops.tiercache.core.CacheStatistics;
import net.wizeops.tiercache.core.CacheTier;
import net.wizeops.tiercache.exceptions.ValidationException;
import net.wizeops.tiercache.monitoring.MeasurementContext;
import net.wizeops.tiercache.monitoring.MemoryUsageSample;
import net.wizeops.tiercache.monitoring.OperationCategory;
import net.wizeops.tiercache.monitoring.PerformanceMonitor;
import net.wizeops.tiercache.utils.CacheUtil;
import net.wizeops.tiercache.utils.GlobPattern;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-process cache with least-recently-used eviction.
 * <p>
 * Entries live in an access-ordered map, so the eviction victim is always the entry whose
 * last read or write happened first; the map's ordering makes that choice deterministic.
 */
@Slf4j
public class MemoryCacheProvider implements CacheProvider {
    private static final String TIER = CacheTier.MEMORY.getValue();

    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final ReentrantLock lock = new ReentrantLock();
    @Getter
    private final int maxEntries;
    @Getter
    private final Duration defaultTtl;
    @Getter
    private final CacheStatistics statistics = new CacheStatistics();
    private final PerformanceMonitor monitor;
    private final Clock clock;
    private long totalBytes;
    private volatile boolean closed;

    public MemoryCacheProvider(CacheConfig config, PerformanceMonitor monitor) {
        this(config.getMemoryCacheSize(), config.getDefaultTtl(), monitor, Clock.systemUTC());
    }

    public MemoryCacheProvider(int maxEntries, Duration defaultTtl) {
        this(maxEntries, defaultTtl, null, Clock.systemUTC());
    }

    public MemoryCacheProvider(int maxEntries, Duration defaultTtl, PerformanceMonitor monitor, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        validateTtl(defaultTtl);
        this.maxEntries = maxEntries;
        this.defaultTtl = defaultTtl;
        this.monitor = PerformanceMonitor.orNoop(monitor);
        this.clock = clock;
    }

    @Override
    public Optional<Object> get(String key) {
        validateKey(key);
        long start = System.nanoTime();
        Object value = null;
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            long now = clock.millis();
            if (entry != null && entry.isExpired(now)) {
                removeEntry(key);
                statistics.recordExpiration();
            } else if (entry != null) {
                entry.recordAccess(now);
                value = entry.getValue();
            }
        } finally {
            lock.unlock();
        }

        if (value != null) {
            statistics.recordHit();
            log.debug("Memory cache hit for key: {}", key);
        } else {
            statistics.recordMiss();
            log.debug("Memory cache miss for key: {}", key);
        }
        monitor.record(OperationCategory.GET, elapsed(start), MeasurementContext.builder()
                .hit(value != null)
                .tier(TIER)
                .build());
        return Optional.ofNullable(value);
    }

    /**
     * Ignored with a warning once the cache is closed.
     */
    @Override
    public void set(String key, Object value, Duration ttl) {
        validateInputs(key, value, ttl);
        if (closed) {
            log.warn("Memory cache is closed, dropping write for key: {}", key);
            return;
        }
        long start = System.nanoTime();
        long size = CacheUtil.estimateObjectSize(value);
        lock.lock();
        try {
            long now = clock.millis();
            removeEntry(key);
            entries.put(key, new CacheEntry(value, now, now + ttl.toMillis(), size, CacheTier.MEMORY));
            totalBytes += size;
            evictOverflow();
        } finally {
            lock.unlock();
        }
        statistics.recordPut();
        monitor.record(OperationCategory.SET, elapsed(start), MeasurementContext.builder()
                .tier(TIER)
                .originalSize(size)
                .build());
    }

    @Override
    public boolean delete(String key) {
        validateKey(key);
        long start = System.nanoTime();
        boolean removed;
        lock.lock();
        try {
            removed = removeEntry(key) != null;
        } finally {
            lock.unlock();
        }
        if (removed) {
            statistics.recordDelete();
        }
        monitor.record(OperationCategory.DELETE, elapsed(start), MeasurementContext.builder()
                .tier(TIER)
                .keysAffected(removed ? 1 : 0)
                .build());
        return removed;
    }

    @Override
    public boolean exists(String key) {
        validateKey(key);
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry != null && entry.isExpired(clock.millis())) {
                removeEntry(key);
                statistics.recordExpiration();
                return false;
            }
            return entry != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int invalidatePattern(String pattern) {
        long start = System.nanoTime();
        Set<String> removed = invalidateMatching(pattern);
        monitor.record(OperationCategory.INVALIDATION, elapsed(start), MeasurementContext.builder()
                .tier(TIER)
                .pattern(pattern)
                .invalidationType("pattern")
                .keysAffected(removed.size())
                .build());
        log.debug("Invalidated {} memory entries matching '{}'", removed.size(), pattern);
        return removed.size();
    }

    /**
     * Removes matching entries without reporting a measurement.
     *
     * @return the removed keys
     */
    public Set<String> invalidateMatching(String pattern) {
        if (pattern == null) {
            throw new ValidationException("pattern", "must not be null");
        }
        GlobPattern glob = GlobPattern.compile(pattern);
        Set<String> removed = new LinkedHashSet<>();
        lock.lock();
        try {
            Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, CacheEntry> entry = it.next();
                String key = entry.getKey();
                if (glob.matches(key)) {
                    totalBytes -= entry.getValue().getSizeBytes();
                    it.remove();
                    removed.add(key);
                }
            }
        } finally {
            lock.unlock();
        }
        statistics.recordBulkDelete(removed.size());
        return removed;
    }

    /**
     * @return number of expired entries dropped
     */
    @Override
    public int removeExpired() {
        int count = 0;
        lock.lock();
        try {
            long now = clock.millis();
            Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                CacheEntry entry = it.next().getValue();
                if (entry.isExpired(now)) {
                    totalBytes -= entry.getSizeBytes();
                    it.remove();
                    count++;
                }
            }
        } finally {
            lock.unlock();
        }
        for (int i = 0; i < count; i++) {
            statistics.recordExpiration();
        }
        return count;
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
            totalBytes = 0;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public MemoryUsageSample getMemoryUsage() {
        lock.lock();
        try {
            return MemoryUsageSample.builder()
                    .totalCacheSizeBytes(totalBytes)
                    .cacheEntryCount(entries.size())
                    .memoryTierBytes(totalBytes)
                    .memoryTierEntries(entries.size())
                    .memoryTierCapacity(maxEntries)
                    .timestamp(clock.instant())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean ping() {
        return !closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            clear();
            log.debug("Memory cache closed");
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public String getProviderName() {
        return "Memory";
    }

    private void evictOverflow() {
        Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
        while (entries.size() > maxEntries && it.hasNext()) {
            Map.Entry<String, CacheEntry> eldest = it.next();
            String key = eldest.getKey();
            totalBytes -= eldest.getValue().getSizeBytes();
            it.remove();
            statistics.recordEviction();
            log.debug("Evicted least recently used key: {}", key);
        }
    }

    private CacheEntry removeEntry(String key) {
        CacheEntry removed = entries.remove(key);
        if (removed != null) {
            totalBytes -= removed.getSizeBytes();
        }
        return removed;
    }

    public static void validateKey(String key) {
        if (key == null) {
            throw new ValidationException("key", "cache key cannot be null");
        }
    }

    static void validateTtl(Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new ValidationException("ttl", "TTL must be positive");
        }
    }

    /**
     * Contract checks shared by every provider.
     */
    public static void validateInputs(String key, Object value, Duration ttl) {
        validateKey(key);
        if (value == null) {
            throw new ValidationException("value", "cache value cannot be null");
        }
        validateTtl(ttl);
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
