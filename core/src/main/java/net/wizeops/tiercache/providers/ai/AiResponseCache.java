package net.wizeops.tiercache.providers.ai;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.wizeops.tiercache.api.CacheProvider;
import net.wizeops.tiercache.config.CacheConfig;
import net.wizeops.tiercache.core.CacheStatistics;
import net.wizeops.tiercache.exceptions.ValidationException;
import net.wizeops.tiercache.keys.KeyGenerator;
import net.wizeops.tiercache.keys.TextTier;
import net.wizeops.tiercache.monitoring.MemoryUsageSample;
import net.wizeops.tiercache.monitoring.PerformanceMonitor;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Caches responses of AI text operations. Keys come from {@link KeyGenerator} and TTLs
 * from the per-operation table of the configuration, falling back to the default TTL.
 * Plain key/value calls are forwarded to the wrapped cache unchanged.
 */
@Slf4j
public class AiResponseCache implements CacheProvider {
    @Getter
    private final CacheProvider delegate;
    @Getter
    private final KeyGenerator keyGenerator;
    private final CacheConfig config;
    private final Map<String, CacheStatistics> operationStatistics = new ConcurrentHashMap<>();

    public AiResponseCache(CacheProvider delegate, CacheConfig config, PerformanceMonitor monitor) {
        this(delegate, config, new KeyGenerator(config.getTextHashThreshold(), monitor));
    }

    public AiResponseCache(CacheProvider delegate, CacheConfig config, KeyGenerator keyGenerator) {
        this.delegate = delegate;
        this.config = config;
        this.keyGenerator = keyGenerator;
    }

    public Duration ttlFor(String operation) {
        return config.ttlForOperation(operation);
    }

    public String buildKey(String text, String operation, Map<String, ?> options, String question) {
        return keyGenerator.generateKey(operation, text, options, question);
    }

    public Optional<Object> getCachedResponse(String text, String operation, Map<String, ?> options) {
        return getCachedResponse(text, operation, options, null);
    }

    public Optional<Object> getCachedResponse(String text, String operation, Map<String, ?> options, String question) {
        String key = buildKey(text, operation, options, question);
        Optional<Object> response = delegate.get(key);
        CacheStatistics stats = statisticsFor(operation);
        if (response.isPresent()) {
            stats.recordHit();
        } else {
            stats.recordMiss();
        }
        log.debug("AI cache {} for operation: {}, text tier: {}", response.isPresent() ? "hit" : "miss",
                operation, TextTier.of(text.length()).getValue());
        return response;
    }

    public void cacheResponse(String text, String operation, Map<String, ?> options, Object response) {
        cacheResponse(text, operation, options, response, null);
    }

    public void cacheResponse(String text, String operation, Map<String, ?> options, Object response, String question) {
        String key = buildKey(text, operation, options, question);
        Duration ttl = ttlFor(operation);
        delegate.set(key, response, ttl);
        statisticsFor(operation).recordPut();
        log.debug("Cached AI response for operation: {} with TTL {}s", operation, ttl.getSeconds());
    }

    /**
     * Drops every cached response of one operation.
     *
     * @return number of keys removed
     */
    public int invalidateByOperation(String operation) {
        if (operation == null || operation.isBlank()) {
            throw new ValidationException("operation", "must not be blank");
        }
        int removed = delegate.invalidatePattern(escapeGlob(operation) + ":*");
        statisticsFor(operation).recordBulkDelete(removed);
        log.info("Invalidated {} cached responses for operation: {}", removed, operation);
        return removed;
    }

    public Map<String, Map<String, Object>> getOperationStatistics() {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        operationStatistics.keySet().stream().sorted()
                .forEach(operation -> result.put(operation, operationStatistics.get(operation).toMap()));
        return Collections.unmodifiableMap(result);
    }

    @Override
    public Optional<Object> get(String key) {
        return delegate.get(key);
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        delegate.set(key, value, ttl);
    }

    @Override
    public boolean delete(String key) {
        return delegate.delete(key);
    }

    @Override
    public boolean exists(String key) {
        return delegate.exists(key);
    }

    @Override
    public int invalidatePattern(String pattern) {
        return delegate.invalidatePattern(pattern);
    }

    @Override
    public boolean ping() {
        return delegate.ping();
    }

    @Override
    public int removeExpired() {
        return delegate.removeExpired();
    }

    @Override
    public void close() {
        delegate.close();
    }

    @Override
    public boolean isClosed() {
        return delegate.isClosed();
    }

    @Override
    public Duration getDefaultTtl() {
        return delegate.getDefaultTtl();
    }

    @Override
    public CacheStatistics getStatistics() {
        return delegate.getStatistics();
    }

    @Override
    public MemoryUsageSample getMemoryUsage() {
        return delegate.getMemoryUsage();
    }

    @Override
    public String getProviderName() {
        return "AiOptimized(" + delegate.getProviderName() + ")";
    }

    @Override
    public boolean isRemoteBacked() {
        return delegate.isRemoteBacked();
    }

    private CacheStatistics statisticsFor(String operation) {
        return operationStatistics.computeIfAbsent(operation, op -> new CacheStatistics());
    }

    static String escapeGlob(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
