package net.wizeops.tiercache.providers.tiered;

import net.wizeops.tiercache.InMemoryRemoteStore;
import net.wizeops.tiercache.MutableClock;
import net.wizeops.tiercache.compression.ValueCodec;
import net.wizeops.tiercache.config.CacheConfig;
import net.wizeops.tiercache.config.CacheStrategy;
import net.wizeops.tiercache.core.CacheEvent;
import net.wizeops.tiercache.core.CacheEventListener;
import net.wizeops.tiercache.encryption.AesGcmEncryptionStrategy;
import net.wizeops.tiercache.exceptions.ValidationException;
import net.wizeops.tiercache.monitoring.CachePerformanceMonitor;
import net.wizeops.tiercache.monitoring.OperationCategory;
import net.wizeops.tiercache.monitoring.StatsSnapshot;
import net.wizeops.tiercache.security.SecurityConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class TwoTierCacheProviderTest {

    private MutableClock clock;
    private InMemoryRemoteStore remote;
    private CachePerformanceMonitor monitor;
    private TwoTierCacheProvider cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        remote = new InMemoryRemoteStore();
        monitor = new CachePerformanceMonitor();
        CacheConfig config = CacheConfig.forStrategy(CacheStrategy.BALANCED)
                .remoteUrl("redis://cache:6379")
                .memoryCacheSize(2)
                .build();
        cache = new TwoTierCacheProvider(config, remote, monitor, clock);
    }

    @Test
    void shouldWriteBothTiers() {
        // When
        cache.set("key", "value", Duration.ofMinutes(5));

        // Then
        assertThat(remote.getData()).containsKey("key");
        assertThat(remote.ttlOf("key")).isEqualTo(Duration.ofMinutes(5));
        assertThat(cache.get("key")).contains("value");
        assertThat(monitor.getStats().getHits()).isEqualTo(1);
    }

    @Test
    void shouldStoreSmallValuesUncompressed() {
        // When
        cache.set("small", "tiny");

        // Then
        assertThat(ValueCodec.isCompressed(remote.getData().get("small"))).isFalse();
        assertThat(monitor.getStats().getCompression().getOperations()).isZero();
    }

    @Test
    void shouldCompressLargeValuesThatShrink() {
        // Given
        String large = "lorem ipsum ".repeat(1000);

        // When
        cache.set("large", large);

        // Then
        byte[] stored = remote.getData().get("large");
        assertThat(ValueCodec.isCompressed(stored)).isTrue();
        assertThat(stored.length).isLessThan(large.length());
        StatsSnapshot.CompressionStats compression = monitor.getStats().getCompression();
        assertThat(compression.getOperations()).isEqualTo(1);
        assertThat(compression.getAverageRatio()).isLessThan(1.0);
    }

    @Test
    void shouldKeepIncompressibleValuesRaw() {
        // Given
        byte[] noise = new byte[4096];
        new Random(42).nextBytes(noise);

        // When
        cache.set("noise", noise);

        // Then
        assertThat(ValueCodec.isCompressed(remote.getData().get("noise"))).isFalse();
        assertThat(monitor.getStats().getCompression().getWorstRatio()).isGreaterThanOrEqualTo(1.0);
    }

    @Test
    void shouldPromoteRemoteHitsIntoMemory() {
        // Given
        String large = "lorem ipsum ".repeat(1000);
        cache.set("large", large);
        cache.set("b", 1);
        cache.set("c", 2);

        // When
        Object fromRemote = cache.get("large").orElseThrow();
        remote.getData().clear();

        // Then
        assertThat(fromRemote).isEqualTo(large);
        assertThat(cache.get("large")).contains(large);
        assertThat(monitor.getStats().getCategories().get(OperationCategory.COMPRESSION).getCount()).isEqualTo(2);
    }

    @Test
    void shouldTreatRemoteFailureAsMiss() {
        // Given
        remote.setFailing(true);

        // When
        boolean found = cache.get("missing").isPresent();

        // Then
        assertThat(found).isFalse();
        assertThat(cache.getStatistics().getErrors()).isEqualTo(1);
        assertThat(monitor.getStats().getCategories().get(OperationCategory.GET).getFailures()).isEqualTo(1);
    }

    @Test
    void shouldRecordFailedMeasurementWhenRemoteExistsCheckFails() {
        // Given
        remote.setFailing(true);

        // When
        boolean exists = cache.exists("missing");

        // Then
        assertThat(exists).isFalse();
        assertThat(cache.getStatistics().getErrors()).isEqualTo(1);
        assertThat(monitor.getStats().getCategories().get(OperationCategory.GET).getFailures()).isEqualTo(1);
    }

    @Test
    void shouldKeepMemoryCopyWhenRemoteWriteFails() {
        // Given
        remote.setFailing(true);

        // When
        cache.set("key", "value");

        // Then
        assertThat(cache.get("key")).contains("value");
        assertThat(cache.getStatistics().getErrors()).isEqualTo(1);
        assertThat(monitor.getStats().getCategories().get(OperationCategory.SET).getFailures()).isEqualTo(1);
        assertThat(cache.ping()).isFalse();
    }

    @Test
    void shouldInvalidateAcrossBothTiers() {
        // Given
        cache.set("summarize:a", 1);
        cache.set("summarize:b", 2);
        cache.set("sentiment:a", 3);

        // When
        int removed = cache.invalidatePattern("summarize:*");

        // Then
        assertThat(removed).isEqualTo(2);
        assertThat(remote.getData()).containsOnlyKeys("sentiment:a");
        assertThat(cache.exists("summarize:a")).isFalse();
        assertThat(cache.exists("sentiment:a")).isTrue();
    }

    @Test
    void shouldDeleteFromBothTiers() {
        // Given
        cache.set("key", "value");

        // When
        boolean deleted = cache.delete("key");

        // Then
        assertThat(deleted).isTrue();
        assertThat(remote.getData()).doesNotContainKey("key");
        assertThat(cache.get("key")).isEmpty();
    }

    @Test
    void shouldIncludeRemoteUsageInMemorySample() {
        // Given
        cache.set("key", "value");

        // When
        long total = cache.getMemoryUsage().getTotalCacheSizeBytes();

        // Then
        assertThat(total).isGreaterThan(cache.getMemoryUsage().getMemoryTierBytes());
    }

    @Test
    void shouldCloseRemoteStore() {
        // When
        cache.close();

        // Then
        assertThat(remote.isClosed()).isTrue();
        assertThat(cache.isClosed()).isTrue();
        assertThat(cache.ping()).isFalse();
        assertThat(cache.isRemoteBacked()).isTrue();
    }

    @Test
    void shouldEncryptRemoteValuesWhenKeyConfigured() {
        // Given
        String key = AesGcmEncryptionStrategy.generateKey();
        TwoTierCacheProvider encrypted = new TwoTierCacheProvider(encryptedConfig(key), remote, monitor, clock);
        String large = "account-42 statement ".repeat(500);

        // When
        encrypted.set("small", "account-42 token");
        encrypted.set("large", large);

        // Then
        byte[] small = remote.getData().get("small");
        assertThat(ValueCodec.isEncrypted(small)).isTrue();
        assertThat(new String(small, StandardCharsets.ISO_8859_1)).doesNotContain("account-42");
        assertThat(ValueCodec.isEncrypted(remote.getData().get("large"))).isTrue();
        assertThat(ValueCodec.isCompressed(remote.getData().get("large"))).isTrue();

        TwoTierCacheProvider reader = new TwoTierCacheProvider(encryptedConfig(key), remote, monitor, clock);
        assertThat(reader.get("small")).contains("account-42 token");
        assertThat(reader.get("large")).contains(large);
    }

    @Test
    void shouldTreatValuesEncryptedWithAnotherKeyAsMisses() {
        // Given
        new TwoTierCacheProvider(encryptedConfig(AesGcmEncryptionStrategy.generateKey()), remote, monitor, clock)
                .set("key", "value");
        TwoTierCacheProvider otherKey = new TwoTierCacheProvider(
                encryptedConfig(AesGcmEncryptionStrategy.generateKey()), remote, monitor, clock);

        // When
        boolean found = otherKey.get("key").isPresent();

        // Then
        assertThat(found).isFalse();
        assertThat(otherKey.getStatistics().getErrors()).isEqualTo(1);
        assertThat(cache.get("key")).isEmpty();
    }

    @Test
    void shouldFireCallbacksForSuccessfulOperations() {
        // Given
        List<String> events = new CopyOnWriteArrayList<>();
        for (CacheEvent event : CacheEvent.values()) {
            cache.registerCallback(event, (key, value) -> events.add(event.getValue() + ":" + key + "=" + value));
        }

        // When
        cache.set("key", "value");
        cache.get("key");
        cache.get("missing");
        cache.delete("key");
        cache.delete("key");

        // Then
        assertThat(events).containsExactly(
                "set_success:key=value",
                "get_success:key=value",
                "get_miss:missing=null",
                "delete_success:key=null");
    }

    @Test
    void shouldNotFireSetSuccessWhenRemoteWriteFails() {
        // Given
        List<String> keys = new ArrayList<>();
        cache.registerCallback(CacheEvent.SET_SUCCESS, (key, value) -> keys.add(key));
        cache.registerCallback(CacheEvent.GET_MISS, (key, value) -> keys.add("miss:" + key));
        remote.setFailing(true);

        // When
        cache.set("key", "value");
        cache.get("other");

        // Then
        assertThat(keys).containsExactly("miss:other");
    }

    @Test
    void shouldSurviveFailingCallbacks() {
        // Given
        List<Object> seen = new ArrayList<>();
        cache.registerCallback(CacheEvent.GET_SUCCESS, (key, value) -> {
            throw new IllegalStateException("listener bug");
        });
        cache.registerCallback(CacheEvent.GET_SUCCESS, (key, value) -> seen.add(value));
        cache.set("key", "value");

        // When
        Object value = cache.get("key").orElseThrow();

        // Then
        assertThat(value).isEqualTo("value");
        assertThat(seen).containsExactly("value");
    }

    @Test
    void shouldStopCallingUnregisteredCallbacks() {
        // Given
        List<String> keys = new ArrayList<>();
        CacheEventListener listener = (key, value) -> keys.add(key);
        cache.registerCallback(CacheEvent.SET_SUCCESS, listener);
        cache.set("first", 1);

        // When
        boolean removed = cache.unregisterCallback(CacheEvent.SET_SUCCESS, listener);
        cache.set("second", 2);

        // Then
        assertThat(removed).isTrue();
        assertThat(keys).containsExactly("first");
        assertThatThrownBy(() -> cache.registerCallback(null, listener))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldServeConsistentValuesUnderConcurrentAccess() throws Exception {
        // Given
        int threads = 8;
        int iterations = 300;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        ConcurrentLinkedQueue<String> mismatches = new ConcurrentLinkedQueue<>();
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int t = 0; t < threads; t++) {
            int thread = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < iterations; i++) {
                    String key = "key-" + (i % 20);
                    cache.set(key, key + "#" + thread + "#" + i);
                    String readKey = "key-" + ((i + thread) % 20);
                    cache.get(readKey).ifPresent(value -> {
                        if (!String.valueOf(value).startsWith(readKey + "#")) {
                            mismatches.add(readKey + " -> " + value);
                        }
                    });
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertThat(mismatches).isEmpty();
        assertThat(cache.getMemoryUsage().getMemoryTierEntries()).isLessThanOrEqualTo(2);
        assertThat(cache.getStatistics().getPuts()).isEqualTo((long) threads * iterations);
        assertThat(remote.getData()).hasSize(20);
    }

    private static CacheConfig encryptedConfig(String key) {
        return CacheConfig.forStrategy(CacheStrategy.BALANCED)
                .remoteUrl("redis://cache:6379")
                .memoryCacheSize(2)
                .securityConfig(SecurityConfig.builder().encryptionKey(key).build())
                .build();
    }
}
