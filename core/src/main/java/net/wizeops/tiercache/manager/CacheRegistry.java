package net.wizeops.tiercache.manager;

import lombok.extern.slf4j.Slf4j;
import net.wizeops.tiercache.api.CacheProvider;
import net.wizeops.tiercache.config.CacheConfig;
import net.wizeops.tiercache.exceptions.CacheException;
import net.wizeops.tiercache.exceptions.ValidationException;
import net.wizeops.tiercache.factory.CacheFactory;
import net.wizeops.tiercache.keys.KeyGenerator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live cache instances keyed by configuration identity or by an explicit name.
 * <p>
 * Equivalent configurations share one instance, and therefore one remote connection
 * pool. The host application calls {@link #close()} from its shutdown sequence.
 */
@Slf4j
public class CacheRegistry implements AutoCloseable {
    private final Map<String, CacheProvider> caches = new ConcurrentHashMap<>();
    private final CacheFactory factory;
    private final ReentrantLock creationLock = new ReentrantLock();
    private final ReentrantLock cleanupLock = new ReentrantLock();
    private final ScheduledExecutorService cleanupExecutor;

    public CacheRegistry(CacheFactory factory) {
        this(factory, null);
    }

    /**
     * @param sweepInterval when non-null, a daemon thread periodically drops closed instances
     *                      and expired memory entries
     */
    public CacheRegistry(CacheFactory factory, Duration sweepInterval) {
        this.factory = factory;
        this.cleanupExecutor = sweepInterval != null ? createAndStartCleanupExecutor(sweepInterval) : null;
    }

    /**
     * Returns the live instance for an equivalent configuration, creating it on first use.
     */
    public CacheProvider getOrCreate(CacheConfig config) {
        String key = identityOf(config);
        CacheProvider existing = caches.get(key);
        if (existing != null && !existing.isClosed()) {
            return existing;
        }
        creationLock.lock();
        try {
            existing = caches.get(key);
            if (existing != null && !existing.isClosed()) {
                return existing;
            }
            CacheProvider created = factory.createCache(config);
            caches.put(key, created);
            log.info("Registered {} cache for strategy {}", created.getProviderName(), config.getStrategy().getValue());
            return created;
        } finally {
            creationLock.unlock();
        }
    }

    /**
     * Registers an instance under a name so it takes part in cleanup and shutdown.
     *
     * @throws CacheException when a live instance is already registered under that name
     */
    public void register(String name, CacheProvider cache) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name", "must not be blank");
        }
        if (cache == null) {
            throw new ValidationException("cache", "must not be null");
        }
        String key = "name:" + name;
        creationLock.lock();
        try {
            CacheProvider existing = caches.get(key);
            if (existing != null && existing != cache && !existing.isClosed()) {
                throw new CacheException("A live cache is already registered as '" + name + "'");
            }
            caches.put(key, cache);
        } finally {
            creationLock.unlock();
        }
    }

    public Optional<CacheProvider> get(String name) {
        return Optional.ofNullable(caches.get("name:" + name)).filter(cache -> !cache.isClosed());
    }

    public int size() {
        return caches.size();
    }

    public Set<String> getRegisteredKeys() {
        return new TreeSet<>(caches.keySet());
    }

    /**
     * Removes references to instances that have been closed. Only one cleanup runs at a time;
     * concurrent callers wait for the running pass.
     */
    public CleanupReport cleanup() {
        cleanupLock.lock();
        try {
            long start = System.nanoTime();
            int cleaned = 0;
            Iterator<Map.Entry<String, CacheProvider>> it = caches.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getValue().isClosed()) {
                    it.remove();
                    cleaned++;
                }
            }
            CleanupReport report = CleanupReport.builder()
                    .cleaned(cleaned)
                    .remaining(caches.size())
                    .duration(Duration.ofNanos(System.nanoTime() - start))
                    .build();
            if (cleaned > 0) {
                log.info("Registry cleanup removed {} closed caches, {} remaining", cleaned, report.getRemaining());
            }
            return report;
        } finally {
            cleanupLock.unlock();
        }
    }

    /**
     * Closes every registered instance, disconnecting remote stores. A failure on one
     * instance is reported and does not stop the others from closing.
     */
    public CleanupReport closeAll() {
        cleanupLock.lock();
        try {
            long start = System.nanoTime();
            int cleaned = 0;
            List<String> errors = new ArrayList<>();
            for (Map.Entry<String, CacheProvider> entry : caches.entrySet()) {
                try {
                    entry.getValue().close();
                    cleaned++;
                } catch (RuntimeException e) {
                    log.warn("Error closing cache '{}'", entry.getKey(), e);
                    errors.add(entry.getKey() + ": " + e.getMessage());
                }
            }
            caches.clear();
            CleanupReport report = CleanupReport.builder()
                    .cleaned(cleaned)
                    .remaining(0)
                    .duration(Duration.ofNanos(System.nanoTime() - start))
                    .errors(errors)
                    .build();
            log.info("Closed {} caches in {} ms ({} errors)", cleaned, report.getDuration().toMillis(), errors.size());
            return report;
        } finally {
            cleanupLock.unlock();
        }
    }

    @Override
    public void close() {
        log.info("Shutting down cache registry");
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdown();
            try {
                if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    cleanupExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cleanupExecutor.shutdownNow();
            }
        }
        closeAll();
    }

    void sweep() {
        try {
            cleanup();
            caches.forEach((key, cache) -> {
                try {
                    int expired = cache.removeExpired();
                    if (expired > 0) {
                        log.debug("Removed {} expired entries from cache: {}", expired, key);
                    }
                } catch (RuntimeException e) {
                    log.error("Error cleaning up cache: {}", key, e);
                }
            });
        } catch (RuntimeException e) {
            log.error("Error during cache registry sweep", e);
        }
    }

    static String identityOf(CacheConfig config) {
        if (config == null) {
            throw new ValidationException("config", "must not be null");
        }
        return "config:" + KeyGenerator.streamingDigest(config.toJson()).substring(0, 32);
    }

    private ScheduledExecutorService createAndStartCleanupExecutor(Duration interval) {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "cache-cleanup-thread");
            thread.setDaemon(true);
            return thread;
        });
        long millis = Math.max(1, interval.toMillis());
        executor.scheduleAtFixedRate(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
        return executor;
    }
}
