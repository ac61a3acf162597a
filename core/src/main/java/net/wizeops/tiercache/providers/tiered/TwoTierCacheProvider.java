package net.wizeops.tiercache.providers.tiered;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.wizeops.tiercache.api.CacheProvider;
import net.wizeops.tiercache.api.RemoteStore;
import net.wizeops.tiercache.compression.EncodedValue;
import net.wizeops.tiercache.compression.ValueCodec;
import net.wizeops.tiercache.config.CacheConfig;
import net.wizeops.tiercache.core.CacheEvent;
import net.wizeops.tiercache.core.CacheEventListener;
import net.wizeops.tiercache.core.CacheStatistics;
import net.wizeops.tiercache.core.CacheTier;
import net.wizeops.tiercache.exceptions.ValidationException;
import net.wizeops.tiercache.monitoring.MeasurementContext;
import net.wizeops.tiercache.monitoring.MemoryUsageSample;
import net.wizeops.tiercache.monitoring.OperationCategory;
import net.wizeops.tiercache.monitoring.PerformanceMonitor;
import net.wizeops.tiercache.providers.memory.MemoryCacheProvider;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Memory tier in front of a {@link RemoteStore}.
 * <p>
 * Reads check memory first and promote remote hits into memory. Writes go to both tiers;
 * the remote copy is compressed above the configured threshold and encrypted when an
 * encryption key is configured. Remote failures are logged and recorded as failed
 * measurements, never thrown: a failed read is a miss and a failed write leaves only the
 * memory copy.
 * <p>
 * Listeners registered with {@link #registerCallback} run on the calling thread after the
 * operation; an exception from a listener is logged and does not affect the operation.
 */
@Slf4j
public class TwoTierCacheProvider implements CacheProvider {
    private static final String MEMORY = CacheTier.MEMORY.getValue();
    private static final String REMOTE = CacheTier.REMOTE.getValue();

    @Getter
    private final CacheConfig config;
    @Getter
    private final RemoteStore remoteStore;
    private final MemoryCacheProvider memoryTier;
    private final ValueCodec codec;
    private final PerformanceMonitor monitor;
    @Getter
    private final CacheStatistics statistics = new CacheStatistics();
    private final Map<CacheEvent, List<CacheEventListener>> listeners = new EnumMap<>(CacheEvent.class);
    private volatile boolean closed;

    public TwoTierCacheProvider(CacheConfig config, RemoteStore remoteStore, PerformanceMonitor monitor) {
        this(config, remoteStore, monitor, Clock.systemUTC());
    }

    public TwoTierCacheProvider(CacheConfig config, RemoteStore remoteStore, PerformanceMonitor monitor, Clock clock) {
        this.config = config;
        this.remoteStore = remoteStore;
        this.monitor = PerformanceMonitor.orNoop(monitor);
        this.memoryTier = new MemoryCacheProvider(config.getMemoryCacheSize(), config.getDefaultTtl(), null, clock);
        this.codec = ValueCodec.forConfig(config);
        for (CacheEvent event : CacheEvent.values()) {
            listeners.put(event, new CopyOnWriteArrayList<>());
        }
        if (!codec.isEncryptionEnabled()) {
            log.warn("No encryption key configured, values in {} are stored unencrypted", remoteStore.getDescription());
        }
    }

    public void registerCallback(CacheEvent event, CacheEventListener listener) {
        if (event == null || listener == null) {
            throw new ValidationException("callback", "event and listener must not be null");
        }
        listeners.get(event).add(listener);
        log.debug("Registered {} callback", event.getValue());
    }

    public boolean unregisterCallback(CacheEvent event, CacheEventListener listener) {
        return event != null && listeners.get(event).remove(listener);
    }

    @Override
    public Optional<Object> get(String key) {
        MemoryCacheProvider.validateKey(key);
        long start = System.nanoTime();

        Optional<Object> local = memoryTier.get(key);
        if (local.isPresent()) {
            statistics.recordHit();
            recordGet(start, true, MEMORY, true);
            fire(CacheEvent.GET_SUCCESS, key, local.get());
            return local;
        }

        try {
            byte[] stored = remoteStore.get(key);
            if (stored == null) {
                statistics.recordMiss();
                recordGet(start, false, REMOTE, true);
                log.debug("Cache miss for key: {}", key);
                fire(CacheEvent.GET_MISS, key, null);
                return Optional.empty();
            }
            Object value = decode(stored);
            memoryTier.set(key, value, config.getDefaultTtl());
            statistics.recordHit();
            recordGet(start, true, REMOTE, true);
            log.debug("Remote hit for key: {}, promoted to memory", key);
            fire(CacheEvent.GET_SUCCESS, key, value);
            return Optional.of(value);
        } catch (RuntimeException e) {
            log.warn("Remote read failed for key: {}, treating as a miss", key, e);
            statistics.recordMiss();
            statistics.recordError();
            recordGet(start, false, REMOTE, false);
            fire(CacheEvent.GET_MISS, key, null);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        MemoryCacheProvider.validateInputs(key, value, ttl);
        long start = System.nanoTime();
        memoryTier.set(key, value, ttl);
        statistics.recordPut();

        MeasurementContext.MeasurementContextBuilder context = MeasurementContext.builder().tier(REMOTE);
        boolean stored = false;
        try {
            EncodedValue encoded = encode(value);
            context.originalSize(encoded.getOriginalSize())
                    .compressedSize(encoded.getStoredSize())
                    .compressionRatio(encoded.getCompressionRatio());
            remoteStore.set(key, encoded.getBytes(), ttl);
            stored = true;
            log.debug("Stored key: {} in both tiers ({} bytes remote, compressed: {})",
                    key, encoded.getStoredSize(), encoded.isCompressed());
        } catch (RuntimeException e) {
            log.warn("Remote write failed for key: {}, value kept in memory only", key, e);
            statistics.recordError();
            context.success(false);
        }
        monitor.record(OperationCategory.SET, elapsed(start), context.build());
        if (stored) {
            fire(CacheEvent.SET_SUCCESS, key, value);
        }
    }

    @Override
    public boolean delete(String key) {
        MemoryCacheProvider.validateKey(key);
        long start = System.nanoTime();
        boolean removed = memoryTier.delete(key);
        boolean success = true;
        try {
            removed = remoteStore.delete(key) || removed;
        } catch (RuntimeException e) {
            log.warn("Remote delete failed for key: {}", key, e);
            statistics.recordError();
            success = false;
        }
        if (removed) {
            statistics.recordDelete();
        }
        monitor.record(OperationCategory.DELETE, elapsed(start), MeasurementContext.builder()
                .tier(REMOTE)
                .success(success)
                .keysAffected(removed ? 1 : 0)
                .build());
        if (removed) {
            fire(CacheEvent.DELETE_SUCCESS, key, null);
        }
        return removed;
    }

    @Override
    public boolean exists(String key) {
        MemoryCacheProvider.validateKey(key);
        if (memoryTier.exists(key)) {
            return true;
        }
        long start = System.nanoTime();
        try {
            return remoteStore.exists(key);
        } catch (RuntimeException e) {
            log.warn("Remote exists check failed for key: {}", key, e);
            statistics.recordError();
            recordGet(start, false, REMOTE, false);
            return false;
        }
    }

    @Override
    public int invalidatePattern(String pattern) {
        if (pattern == null) {
            throw new ValidationException("pattern", "must not be null");
        }
        long start = System.nanoTime();
        Set<String> removed = new LinkedHashSet<>(memoryTier.invalidateMatching(pattern));
        boolean success = true;
        try {
            Set<String> remoteKeys = remoteStore.scan(pattern);
            if (!remoteKeys.isEmpty()) {
                remoteStore.deleteAll(remoteKeys);
                removed.addAll(remoteKeys);
            }
        } catch (RuntimeException e) {
            log.warn("Remote invalidation failed for pattern: {}, only the memory tier was cleared", pattern, e);
            statistics.recordError();
            success = false;
        }
        statistics.recordBulkDelete(removed.size());
        monitor.record(OperationCategory.INVALIDATION, elapsed(start), MeasurementContext.builder()
                .tier(REMOTE)
                .success(success)
                .pattern(pattern)
                .invalidationType("pattern")
                .keysAffected(removed.size())
                .build());
        log.info("Invalidated {} keys matching '{}'", removed.size(), pattern);
        return removed.size();
    }

    @Override
    public boolean ping() {
        if (closed) {
            return false;
        }
        try {
            return remoteStore.ping();
        } catch (RuntimeException e) {
            log.warn("Remote ping failed", e);
            return false;
        }
    }

    @Override
    public MemoryUsageSample getMemoryUsage() {
        MemoryUsageSample local = memoryTier.getMemoryUsage();
        OptionalLong remoteBytes = OptionalLong.empty();
        try {
            remoteBytes = remoteStore.usedMemoryBytes();
        } catch (RuntimeException e) {
            log.debug("Remote memory usage unavailable", e);
        }
        return local.toBuilder()
                .totalCacheSizeBytes(local.getMemoryTierBytes() + remoteBytes.orElse(0))
                .build();
    }

    /**
     * Removes expired memory-tier entries; the remote store expires its own keys.
     */
    @Override
    public int removeExpired() {
        return memoryTier.removeExpired();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        memoryTier.close();
        try {
            remoteStore.close();
            log.info("Closed two-tier cache for {}", remoteStore.getDescription());
        } catch (RuntimeException e) {
            log.warn("Error closing remote store {}", remoteStore.getDescription(), e);
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public Duration getDefaultTtl() {
        return config.getDefaultTtl();
    }

    @Override
    public String getProviderName() {
        return "TwoTier";
    }

    @Override
    public boolean isRemoteBacked() {
        return true;
    }

    private EncodedValue encode(Object value) {
        long start = System.nanoTime();
        EncodedValue encoded = codec.encode(value);
        if (encoded.isCompressionAttempted()) {
            monitor.record(OperationCategory.COMPRESSION, elapsed(start), MeasurementContext.builder()
                    .operation("compress")
                    .originalSize(encoded.getOriginalSize())
                    .compressedSize(encoded.isCompressed() ? encoded.getStoredSize() : encoded.getOriginalSize())
                    .compressionRatio(encoded.getCompressionRatio())
                    .build());
        }
        return encoded;
    }

    private Object decode(byte[] stored) {
        if (!ValueCodec.isCompressed(stored)) {
            return codec.decode(stored);
        }
        long start = System.nanoTime();
        Object value = codec.decode(stored);
        monitor.record(OperationCategory.COMPRESSION, elapsed(start), MeasurementContext.builder()
                .operation("decompress")
                .compressedSize(stored.length)
                .build());
        return value;
    }

    private void fire(CacheEvent event, String key, Object value) {
        for (CacheEventListener listener : listeners.get(event)) {
            try {
                listener.onEvent(key, value);
            } catch (RuntimeException e) {
                log.warn("{} callback failed for key: {}", event.getValue(), key, e);
            }
        }
    }

    private void recordGet(long start, boolean hit, String tier, boolean success) {
        monitor.record(OperationCategory.GET, elapsed(start), MeasurementContext.builder()
                .hit(hit)
                .tier(tier)
                .success(success)
                .build());
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
