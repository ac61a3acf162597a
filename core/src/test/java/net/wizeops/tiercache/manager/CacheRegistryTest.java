package net.wizeops.tiercache.manager;

import net.wizeops.tiercache.api.CacheProvider;
import net.wizeops.tiercache.config.CacheConfig;
import net.wizeops.tiercache.config.CacheStrategy;
import net.wizeops.tiercache.exceptions.CacheException;
import net.wizeops.tiercache.exceptions.ValidationException;
import net.wizeops.tiercache.factory.CacheFactory;
import net.wizeops.tiercache.providers.memory.MemoryCacheProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class CacheRegistryTest {

    private CacheRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CacheRegistry(new CacheFactory());
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void shouldReturnSameInstanceForEquivalentConfigurations() {
        // Given
        CacheConfig first = CacheConfig.defaults(CacheStrategy.FAST);
        CacheConfig second = CacheConfig.forStrategy(CacheStrategy.FAST).build();

        // When / Then
        assertThat(registry.getOrCreate(first)).isSameAs(registry.getOrCreate(second));
        assertThat(registry.getOrCreate(CacheConfig.defaults(CacheStrategy.ROBUST)))
                .isNotSameAs(registry.getOrCreate(first));
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void shouldCreateOnlyOneInstanceUnderConcurrency() throws Exception {
        // Given
        CacheConfig config = CacheConfig.defaults(CacheStrategy.BALANCED);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        Set<CacheProvider> seen = ConcurrentHashMap.newKeySet();
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < 16; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                seen.add(registry.getOrCreate(config));
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertThat(seen).hasSize(1);
    }

    @Test
    void shouldReplaceClosedInstances() {
        // Given
        CacheConfig config = CacheConfig.defaults(CacheStrategy.FAST);
        CacheProvider first = registry.getOrCreate(config);

        // When
        first.close();
        CacheProvider second = registry.getOrCreate(config);

        // Then
        assertThat(second).isNotSameAs(first);
        assertThat(second.isClosed()).isFalse();
    }

    @Test
    void shouldRemoveClosedInstancesOnCleanup() {
        // Given
        CacheProvider live = new MemoryCacheProvider(10, Duration.ofMinutes(1));
        CacheProvider closed = new MemoryCacheProvider(10, Duration.ofMinutes(1));
        registry.register("live", live);
        registry.register("closed", closed);
        closed.close();

        // When
        CleanupReport report = registry.cleanup();

        // Then
        assertThat(report.getCleaned()).isEqualTo(1);
        assertThat(report.getRemaining()).isEqualTo(1);
        assertThat(registry.get("live")).contains(live);
        assertThat(registry.get("closed")).isEmpty();
    }

    @Test
    void shouldRejectDuplicateLiveNames() {
        // Given
        registry.register("main", new MemoryCacheProvider(10, Duration.ofMinutes(1)));

        // When / Then
        assertThatThrownBy(() -> registry.register("main", new MemoryCacheProvider(10, Duration.ofMinutes(1))))
                .isInstanceOf(CacheException.class);
        assertThatThrownBy(() -> registry.register(" ", new MemoryCacheProvider(10, Duration.ofMinutes(1))))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldCloseEveryInstanceEvenWhenOneFails() {
        // Given
        CacheProvider failing = mock(CacheProvider.class);
        doThrow(new IllegalStateException("stuck")).when(failing).close();
        CacheProvider healthy = new MemoryCacheProvider(10, Duration.ofMinutes(1));
        registry.register("failing", failing);
        registry.register("healthy", healthy);

        // When
        CleanupReport report = registry.closeAll();

        // Then
        assertThat(healthy.isClosed()).isTrue();
        assertThat(report.getCleaned()).isEqualTo(1);
        assertThat(report.getErrors()).containsExactly("name:failing: stuck");
        assertThat(registry.size()).isZero();
    }

    @Test
    void shouldRemoveExpiredEntriesDuringSweep() throws InterruptedException {
        // Given
        MemoryCacheProvider cache = new MemoryCacheProvider(10, Duration.ofMinutes(1));
        cache.set("short", "value", Duration.ofMillis(1));
        registry.register("sweep", cache);
        Thread.sleep(5);

        // When
        registry.sweep();

        // Then
        assertThat(cache.size()).isZero();
    }

    @Test
    void shouldDeriveIdentityFromConfiguration() {
        assertThat(CacheRegistry.identityOf(CacheConfig.defaults(CacheStrategy.FAST)))
                .startsWith("config:")
                .isEqualTo(CacheRegistry.identityOf(CacheConfig.defaults(CacheStrategy.FAST)))
                .isNotEqualTo(CacheRegistry.identityOf(CacheConfig.defaults(CacheStrategy.BALANCED)));
    }
}
