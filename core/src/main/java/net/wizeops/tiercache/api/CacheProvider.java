package net.wizeops.tiercache.api;

import net.wizeops.tiercache.core.CacheStatistics;
import net.wizeops.tiercache.monitoring.MemoryUsageSample;

import java.time.Duration;
import java.util.Optional;

/**
 * Capability shared by every cache variant. Implementations are safe for concurrent use
 * and never let a remote-tier failure escape from {@code get}, {@code set},
 * {@code delete} or {@code exists}: reads degrade to a miss, writes to a no-op.
 */
public interface CacheProvider extends AutoCloseable {

    Optional<Object> get(String key);

    void set(String key, Object value, Duration ttl);

    default void set(String key, Object value) {
        set(key, value, getDefaultTtl());
    }

    /**
     * @return whether an entry was removed from any tier
     */
    boolean delete(String key);

    boolean exists(String key);

    /**
     * Removes every key matching a glob pattern ({@code *}, {@code ?}, {@code [...]}).
     *
     * @return number of distinct keys removed
     */
    int invalidatePattern(String pattern);

    /**
     * Lightweight liveness probe; preferred by health checks over a set/get round trip.
     */
    boolean ping();

    /**
     * Drops expired in-process entries. Remote stores expire their own keys.
     *
     * @return number of entries dropped
     */
    default int removeExpired() {
        return 0;
    }

    @Override
    void close();

    boolean isClosed();

    Duration getDefaultTtl();

    CacheStatistics getStatistics();

    MemoryUsageSample getMemoryUsage();

    String getProviderName();

    /**
     * True when values are also written to a remote store, false for memory-only caches
     * including those created as a fallback.
     */
    default boolean isRemoteBacked() {
        return false;
    }

    default <T> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }
}
