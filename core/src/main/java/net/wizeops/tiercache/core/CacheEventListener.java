package net.wizeops.tiercache.core;

/**
 * Called synchronously on the thread that performed the operation.
 */
@FunctionalInterface
public interface CacheEventListener {
    /**
     * @param value the value read or written, {@code null} for misses and deletes
     */
    void onEvent(String key, Object value);
}
