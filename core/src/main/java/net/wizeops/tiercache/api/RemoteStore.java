package net.wizeops.tiercache.api;

import java.time.Duration;
import java.util.Collection;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Byte-level access to the remote tier. Every method may throw
 * {@link net.wizeops.tiercache.exceptions.InfrastructureException}; callers on the hot
 * path convert those into misses.
 */
public interface RemoteStore extends AutoCloseable {

    byte[] get(String key);

    void set(String key, byte[] value, Duration ttl);

    boolean delete(String key);

    boolean exists(String key);

    /**
     * Keys matching a glob pattern, collected with a cursor scan rather than a blocking
     * full keyspace listing.
     */
    Set<String> scan(String pattern);

    long deleteAll(Collection<String> keys);

    boolean ping();

    /**
     * Memory the store reports as used, when it reports it.
     */
    OptionalLong usedMemoryBytes();

    String getDescription();

    @Override
    void close();
}
