package net.wizeops.tiercache.monitoring;

import net.wizeops.tiercache.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class CachePerformanceMonitorTest {

    private MutableClock clock;
    private CachePerformanceMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        monitor = new CachePerformanceMonitor(MonitorSettings.DEFAULTS, clock);
    }

    @Test
    void shouldReportZeroedStatsWhenNothingRecorded() {
        // When
        StatsSnapshot stats = monitor.getStats();

        // Then
        assertThat(stats.getHitRate()).isZero();
        assertThat(stats.getTotalOperations()).isZero();
        assertThat(stats.getCategories()).containsOnlyKeys(OperationCategory.values());
        assertThat(stats.getCategories().get(OperationCategory.GET).getCount()).isZero();
        assertThat(stats.getCompression().getOperations()).isZero();
        assertThat(stats.getMemory().isMeasured()).isFalse();
        assertThat(stats.getInvalidation().getTotalInvalidations()).isZero();
        assertThat(monitor.getMemoryWarnings()).isEmpty();
        assertThat(monitor.getInvalidationRecommendations()).isEmpty();
    }

    @Test
    void shouldComputeHitRateFromGetMeasurements() {
        // Given
        recordGet(true);
        recordGet(true);
        recordGet(true);
        recordGet(false);

        // When
        StatsSnapshot stats = monitor.getStats();

        // Then
        assertThat(stats.getHits()).isEqualTo(3);
        assertThat(stats.getMisses()).isEqualTo(1);
        assertThat(stats.getHitRate()).isEqualTo(0.75);
        assertThat(monitor.getHitRate()).isEqualTo(0.75);
        assertThat(stats.getTotalOperations()).isEqualTo(4);
    }

    @Test
    void shouldFlagOperationsSlowerThanTwiceTheCategoryAverage() {
        // Given
        for (int i = 0; i < 9; i++) {
            monitor.record(OperationCategory.GET, Duration.ofMillis(10), MeasurementContext.builder().hit(true).build());
        }
        monitor.record(OperationCategory.GET, Duration.ofMillis(100), MeasurementContext.builder().hit(true).build());

        // When
        Map<OperationCategory, List<SlowOperation>> slow = monitor.getSlowOperations();

        // Then
        assertThat(slow.get(OperationCategory.GET)).hasSize(1);
        SlowOperation operation = slow.get(OperationCategory.GET).get(0);
        assertThat(operation.getMeasurement().getDurationMillis()).isEqualTo(100.0);
        assertThat(operation.getCategoryAverageMillis()).isEqualTo(19.0);
        assertThat(operation.getTimesSlower()).isCloseTo(5.26, within(0.01));
        assertThat(slow.get(OperationCategory.SET)).isEmpty();
    }

    @Test
    void shouldRejectNonPositiveSlowOperationMultiplier() {
        assertThatThrownBy(() -> monitor.getSlowOperations(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldAggregateDurationsPerCategory() {
        // Given
        monitor.record(OperationCategory.SET, Duration.ofMillis(2), MeasurementContext.EMPTY);
        monitor.record(OperationCategory.SET, Duration.ofMillis(4), MeasurementContext.EMPTY);
        monitor.record(OperationCategory.SET, Duration.ofMillis(9), MeasurementContext.builder().success(false).build());

        // When
        StatsSnapshot.CategoryStats stats = monitor.getStats().getCategories().get(OperationCategory.SET);

        // Then
        assertThat(stats.getCount()).isEqualTo(3);
        assertThat(stats.getFailures()).isEqualTo(1);
        assertThat(stats.getAverageMillis()).isEqualTo(5.0);
        assertThat(stats.getMedianMillis()).isEqualTo(4.0);
        assertThat(stats.getMinMillis()).isEqualTo(2.0);
        assertThat(stats.getMaxMillis()).isEqualTo(9.0);
    }

    @Test
    void shouldSummarizeCompressionRatios() {
        // Given
        monitor.record(OperationCategory.COMPRESSION, Duration.ofMillis(1), MeasurementContext.builder()
                .originalSize(1000).compressedSize(400).compressionRatio(0.4).build());
        monitor.record(OperationCategory.COMPRESSION, Duration.ofMillis(1), MeasurementContext.builder()
                .originalSize(1000).compressedSize(600).compressionRatio(0.6).build());
        monitor.record(OperationCategory.COMPRESSION, Duration.ofMillis(1), MeasurementContext.builder()
                .operation("decompress").compressedSize(400).build());

        // When
        StatsSnapshot.CompressionStats stats = monitor.getStats().getCompression();

        // Then
        assertThat(stats.getOperations()).isEqualTo(2);
        assertThat(stats.getAverageRatio()).isCloseTo(0.5, within(1e-9));
        assertThat(stats.getBestRatio()).isEqualTo(0.4);
        assertThat(stats.getWorstRatio()).isEqualTo(0.6);
        assertThat(stats.getTotalBytesProcessed()).isEqualTo(2000);
        assertThat(stats.getTotalBytesSaved()).isEqualTo(1000);
    }

    @Test
    void shouldKeepSettingsButDropDataOnReset() {
        // Given
        MonitorSettings settings = MonitorSettings.builder().maxMeasurements(5).build();
        CachePerformanceMonitor bounded = new CachePerformanceMonitor(settings, clock);
        bounded.record(OperationCategory.GET, Duration.ofMillis(1), MeasurementContext.builder().hit(true).build());

        // When
        bounded.reset();

        // Then
        assertThat(bounded.getSettings()).isEqualTo(settings);
        assertThat(bounded.getStats().getHits()).isZero();
        assertThat(bounded.getStats().getCategories().get(OperationCategory.GET).getCount()).isZero();
    }

    @Test
    void shouldBoundEachCategoryToMaxMeasurements() {
        // Given
        CachePerformanceMonitor bounded = new CachePerformanceMonitor(
                MonitorSettings.builder().maxMeasurements(3).build(), clock);

        // When
        for (int i = 0; i < 10; i++) {
            bounded.record(OperationCategory.SET, Duration.ofMillis(i), MeasurementContext.EMPTY);
        }

        // Then
        StatsSnapshot.CategoryStats stats = bounded.getStats().getCategories().get(OperationCategory.SET);
        assertThat(stats.getCount()).isEqualTo(3);
        assertThat(stats.getMinMillis()).isEqualTo(7.0);
    }

    @Test
    void shouldDropMeasurementsOlderThanRetention() {
        // Given
        monitor.record(OperationCategory.SET, Duration.ofMillis(1), MeasurementContext.EMPTY);

        // When
        clock.advance(Duration.ofHours(2));

        // Then
        assertThat(monitor.getStats().getCategories().get(OperationCategory.SET).getCount()).isZero();
    }

    @Test
    void shouldWarnWhenMemoryCrossesThresholds() {
        // Given
        CachePerformanceMonitor small = new CachePerformanceMonitor(MonitorSettings.builder()
                .memoryWarningThresholdBytes(1_000)
                .memoryCriticalThresholdBytes(2_000)
                .build(), clock);

        // When
        small.recordMemoryUsage(MemoryUsageSample.builder().totalCacheSizeBytes(1_500).build());
        List<MonitoringAlert> warning = small.getMemoryWarnings();
        small.recordMemoryUsage(MemoryUsageSample.builder().totalCacheSizeBytes(2_500).build());
        List<MonitoringAlert> critical = small.getMemoryWarnings();

        // Then
        assertThat(warning).extracting(MonitoringAlert::getSeverity).containsExactly(Severity.WARNING);
        assertThat(critical).extracting(MonitoringAlert::getSeverity).containsExactly(Severity.CRITICAL);
        assertThat(critical.get(0).getSuggestions()).isNotEmpty();
        assertThat(small.getStats().getMemory().isCriticalThresholdReached()).isTrue();
    }

    @Test
    void shouldReportNearlyFullMemoryTier() {
        // When
        monitor.recordMemoryUsage(MemoryUsageSample.builder()
                .totalCacheSizeBytes(100)
                .memoryTierEntries(95)
                .memoryTierCapacity(100)
                .build());

        // Then
        assertThat(monitor.getMemoryWarnings())
                .extracting(MonitoringAlert::getIssue)
                .containsExactly("Memory tier nearly full");
    }

    @Test
    void shouldRecommendOnFrequentAndIneffectiveInvalidations() {
        // Given
        CachePerformanceMonitor sensitive = new CachePerformanceMonitor(MonitorSettings.builder()
                .invalidationWarningPerHour(5)
                .invalidationCriticalPerHour(20)
                .build(), clock);

        // When
        for (int i = 0; i < 10; i++) {
            sensitive.record(OperationCategory.INVALIDATION, Duration.ofMillis(1), MeasurementContext.builder()
                    .pattern("summarize:*")
                    .invalidationType("pattern")
                    .keysAffected(0)
                    .build());
        }
        List<MonitoringAlert> recommendations = sensitive.getInvalidationRecommendations();

        // Then
        assertThat(recommendations).extracting(MonitoringAlert::getIssue)
                .containsExactly("High invalidation frequency", "Dominant invalidation pattern", "Low invalidation efficiency");
        assertThat(recommendations.get(0).getSeverity()).isEqualTo(Severity.WARNING);
        StatsSnapshot.InvalidationStats stats = sensitive.getStats().getInvalidation();
        assertThat(stats.getTotalInvalidations()).isEqualTo(10);
        assertThat(stats.getAlertLevel()).isEqualTo("warning");
        assertThat(stats.getMostCommonPatterns()).containsEntry("summarize:*", 10L);
    }

    @Test
    void shouldExportRawMeasurementsAndSettings() {
        // Given
        recordGet(true);

        // When
        Map<String, Object> export = monitor.export();

        // Then
        assertThat(export).containsKeys("measurements", "memoryUsage", "settings", "exportTimestamp");
        assertThat(export.get("hits")).isEqualTo(1L);
    }

    @Test
    void shouldIgnoreIncompleteMeasurements() {
        // When
        monitor.record(null, Duration.ofMillis(1), MeasurementContext.EMPTY);
        monitor.record(OperationCategory.GET, null, MeasurementContext.EMPTY);

        // Then
        assertThat(monitor.getStats().getTotalOperations()).isZero();
    }

    @Test
    void shouldCountEveryConcurrentRecord() throws Exception {
        // Given
        int threads = 8;
        int perThread = 1000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    recordGet(i % 2 == 0);
                    monitor.record(OperationCategory.SET, Duration.ofMillis(1), MeasurementContext.EMPTY);
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
        StatsSnapshot stats = monitor.getStats();
        long total = (long) threads * perThread;
        assertThat(stats.getHits()).isEqualTo(total / 2);
        assertThat(stats.getMisses()).isEqualTo(total / 2);
        assertThat(stats.getTotalOperations()).isEqualTo(total * 2);
        assertThat(stats.getHitRate()).isEqualTo(0.5);
        assertThat(stats.getCategories().get(OperationCategory.GET).getCount())
                .isEqualTo(MonitorSettings.DEFAULTS.getMaxMeasurements());
    }

    private void recordGet(boolean hit) {
        monitor.record(OperationCategory.GET, Duration.ofMillis(1), MeasurementContext.builder().hit(hit).build());
    }
}
