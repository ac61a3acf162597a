package net.wizeops.tiercache.providers.redis;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.wizeops.tiercache.api.RemoteStore;
import net.wizeops.tiercache.config.CacheConfig;
import net.wizeops.tiercache.exceptions.InfrastructureException;
import net.wizeops.tiercache.security.SecurityConfig;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisClientConfig;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.params.SetParams;
import redis.clients.jedis.resps.ScanResult;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Function;

/**
 * Redis backed remote tier. Keys are namespaced with {@value #KEY_PREFIX}; the prefix is
 * added and stripped here so callers only see their own keys.
 */
@Slf4j
public class RedisRemoteStore implements RemoteStore {
    public static final String KEY_PREFIX = "tiercache:";
    static final int SCAN_COUNT = 500;
    static final int DELETE_BATCH_SIZE = 500;

    private final JedisPool jedisPool;
    @Getter
    private final RedisEndpoint endpoint;

    public RedisRemoteStore(CacheConfig config) {
        if (!config.hasRemote()) {
            throw new InfrastructureException("No remote URL configured");
        }
        this.endpoint = RedisEndpoint.parse(config.getRemoteUrl());

        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(config.getMaxConnections());
        poolConfig.setMaxIdle(config.getMaxConnections());
        poolConfig.setMinIdle(Math.min(2, config.getMaxConnections()));
        poolConfig.setTestOnBorrow(true);
        poolConfig.setTestOnReturn(true);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setMaxWait(config.getConnectionTimeout());

        this.jedisPool = new JedisPool(poolConfig, new HostAndPort(endpoint.getHost(), endpoint.getPort()),
                clientConfig(config, endpoint));

        try (Jedis jedis = jedisPool.getResource()) {
            if (!"PONG".equalsIgnoreCase(jedis.ping())) {
                throw new InfrastructureException("Cannot connect to Redis server " + endpoint.describe());
            }
            log.info("Connected to Redis server: {}", endpoint.describe());
        } catch (RuntimeException e) {
            jedisPool.close();
            log.error("Failed to connect to Redis at {}", endpoint.describe(), e);
            if (e instanceof InfrastructureException) {
                throw e;
            }
            throw new InfrastructureException("Failed to connect to Redis server " + endpoint.describe(), e);
        }
    }

    @Override
    public byte[] get(String key) {
        return execute(jedis -> jedis.get(bytes(formatKey(key))));
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        execute(jedis -> jedis.set(bytes(formatKey(key)), value, SetParams.setParams().px(ttl.toMillis())));
        log.debug("Stored {} bytes in Redis for key: {}", value.length, key);
    }

    @Override
    public boolean delete(String key) {
        return execute(jedis -> jedis.del(formatKey(key))) > 0;
    }

    @Override
    public boolean exists(String key) {
        return execute(jedis -> jedis.exists(formatKey(key)));
    }

    @Override
    public Set<String> scan(String pattern) {
        return execute(jedis -> {
            Set<String> keys = new LinkedHashSet<>();
            ScanParams params = new ScanParams().match(KEY_PREFIX + pattern).count(SCAN_COUNT);
            String cursor = ScanParams.SCAN_POINTER_START;
            do {
                ScanResult<String> page = jedis.scan(cursor, params);
                page.getResult().forEach(key -> keys.add(stripKeyPrefix(key)));
                cursor = page.getCursor();
            } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
            return keys;
        });
    }

    @Override
    public long deleteAll(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        List<String> formatted = new ArrayList<>(keys.size());
        keys.forEach(key -> formatted.add(formatKey(key)));
        return execute(jedis -> {
            long deleted = 0;
            for (int from = 0; from < formatted.size(); from += DELETE_BATCH_SIZE) {
                List<String> batch = formatted.subList(from, Math.min(from + DELETE_BATCH_SIZE, formatted.size()));
                deleted += jedis.del(batch.toArray(new String[0]));
            }
            return deleted;
        });
    }

    @Override
    public boolean ping() {
        return "PONG".equalsIgnoreCase(execute(Jedis::ping));
    }

    @Override
    public OptionalLong usedMemoryBytes() {
        return parseUsedMemory(execute(jedis -> jedis.info("memory")));
    }

    @Override
    public String getDescription() {
        return endpoint.describe();
    }

    @Override
    public void close() {
        jedisPool.close();
        log.info("Redis connection pool for {} closed", endpoint.describe());
    }

    private <T> T execute(Function<Jedis, T> action) {
        try (Jedis jedis = jedisPool.getResource()) {
            return action.apply(jedis);
        } catch (RuntimeException e) {
            throw new InfrastructureException("Redis operation failed on " + endpoint.describe(), e);
        }
    }

    static JedisClientConfig clientConfig(CacheConfig config, RedisEndpoint endpoint) {
        int timeoutMillis = (int) config.getConnectionTimeout().toMillis();
        DefaultJedisClientConfig.Builder builder = DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis(timeoutMillis)
                .socketTimeoutMillis(timeoutMillis)
                .database(endpoint.getDatabase())
                .clientName("tiercache");

        SecurityConfig security = config.getSecurityConfig();
        if (security != null && security.hasAcl()) {
            builder.user(security.getAclUsername()).password(security.getAclPassword());
        } else if (security != null && security.hasAuthentication()) {
            builder.password(security.getAuthPassword());
        } else if (endpoint.hasCredentials()) {
            builder.user(endpoint.getUsername()).password(endpoint.getPassword());
        }

        boolean tls = endpoint.isTls() || (security != null && security.isTlsEnabled());
        if (tls) {
            builder.ssl(true);
            if (security != null) {
                builder.sslSocketFactory(new TlsSocketFactoryBuilder(security).build());
                if (!security.isVerifyCertificates()) {
                    builder.hostnameVerifier((host, session) -> true);
                }
            }
        }
        return builder.build();
    }

    static OptionalLong parseUsedMemory(String info) {
        if (info == null) {
            return OptionalLong.empty();
        }
        for (String line : info.split("\r?\n")) {
            if (line.startsWith("used_memory:")) {
                try {
                    return OptionalLong.of(Long.parseLong(line.substring("used_memory:".length()).trim()));
                } catch (NumberFormatException e) {
                    log.debug("Unparseable used_memory line: {}", line);
                    return OptionalLong.empty();
                }
            }
        }
        return OptionalLong.empty();
    }

    static String formatKey(String key) {
        return KEY_PREFIX + key;
    }

    static String stripKeyPrefix(String key) {
        return key.startsWith(KEY_PREFIX) ? key.substring(KEY_PREFIX.length()) : key;
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
