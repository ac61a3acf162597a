package net.wizeops.tiercache.monitoring;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.wizeops.tiercache.monitoring.StatsSnapshot.CategoryStats;
import net.wizeops.tiercache.monitoring.StatsSnapshot.CompressionStats;
import net.wizeops.tiercache.monitoring.StatsSnapshot.InvalidationStats;
import net.wizeops.tiercache.monitoring.StatsSnapshot.MemoryStats;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory recorder and analyzer for cache telemetry.
 * <p>
 * Measurements are kept per {@link OperationCategory}, bounded by
 * {@link MonitorSettings#getMaxMeasurements()} on every write and by
 * {@link MonitorSettings#getRetentionHours()} on every query. Hit and miss counters are
 * cumulative until {@link #reset()}.
 * <p>
 * All mutation and analysis happens under a single lock, so {@link #record} may be called
 * from any number of threads.
 */
@Slf4j
public class CachePerformanceMonitor implements PerformanceMonitor {
    private static final int TREND_WINDOW = 10;
    private static final int PATTERN_WINDOW = 50;
    private static final int TOP_PATTERNS = 10;
    private static final int DOMINANT_PATTERN_MIN_EVENTS = 10;
    private static final int EFFICIENCY_MIN_EVENTS = 5;
    private static final double MEMORY_TIER_FULL_PERCENT = 90.0;
    private static final double GROWTH_ALERT_HOURS = 6.0;
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    @Getter
    private final MonitorSettings settings;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<OperationCategory, Deque<PerformanceMeasurement>> measurements =
            new EnumMap<>(OperationCategory.class);
    private final Deque<MemoryUsageSample> memorySamples = new ArrayDeque<>();

    private long hits;
    private long misses;
    private long totalOperations;
    private long totalInvalidations;
    private long totalKeysInvalidated;

    public CachePerformanceMonitor() {
        this(MonitorSettings.DEFAULTS, Clock.systemUTC());
    }

    public CachePerformanceMonitor(MonitorSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public CachePerformanceMonitor(MonitorSettings settings, Clock clock) {
        if (settings.getRetentionHours() <= 0 || settings.getMaxMeasurements() <= 0) {
            throw new IllegalArgumentException("retentionHours and maxMeasurements must be positive");
        }
        if (settings.getMemoryCriticalThresholdBytes() < settings.getMemoryWarningThresholdBytes()) {
            throw new IllegalArgumentException("Memory critical threshold must not be below the warning threshold");
        }
        this.settings = settings;
        this.clock = clock;
        for (OperationCategory category : OperationCategory.values()) {
            measurements.put(category, new ArrayDeque<>());
        }
    }

    @Override
    public void record(OperationCategory category, Duration duration, MeasurementContext context) {
        if (category == null || duration == null) {
            return;
        }
        MeasurementContext effectiveContext = context != null ? context : MeasurementContext.EMPTY;
        PerformanceMeasurement measurement = PerformanceMeasurement.builder()
                .category(category)
                .duration(duration.isNegative() ? Duration.ZERO : duration)
                .timestamp(clock.instant())
                .context(effectiveContext)
                .build();

        long invalidationsLastHour = -1;
        lock.lock();
        try {
            Deque<PerformanceMeasurement> series = measurements.get(category);
            series.addLast(measurement);
            trimToCapacity(series);

            switch (category) {
                case GET -> {
                    totalOperations++;
                    if (effectiveContext.getHit() != null) {
                        if (effectiveContext.getHit()) {
                            hits++;
                        } else {
                            misses++;
                        }
                    }
                }
                case SET, DELETE -> totalOperations++;
                case INVALIDATION -> {
                    totalInvalidations++;
                    totalKeysInvalidated += effectiveContext.getKeysAffected();
                    invalidationsLastHour = countSince(series, clock.instant().minus(Duration.ofHours(1)));
                }
                default -> {
                }
            }
        } finally {
            lock.unlock();
        }

        logIfSlow(measurement);
        if (invalidationsLastHour >= 0) {
            logInvalidationRate(invalidationsLastHour, effectiveContext);
        }
    }

    @Override
    public void recordMemoryUsage(MemoryUsageSample sample) {
        if (sample == null) {
            return;
        }
        MemoryUsageSample stamped = sample.getTimestamp() != null ? sample : sample.toBuilder().timestamp(clock.instant()).build();
        lock.lock();
        try {
            memorySamples.addLast(stamped);
            trimToCapacity(memorySamples);
        } finally {
            lock.unlock();
        }

        long total = stamped.getTotalCacheSizeBytes();
        if (total >= settings.getMemoryCriticalThresholdBytes()) {
            log.error("Critical cache memory usage: {} MB (threshold {} MB)",
                    formatMb(total), formatMb(settings.getMemoryCriticalThresholdBytes()));
        } else if (total >= settings.getMemoryWarningThresholdBytes()) {
            log.warn("High cache memory usage: {} MB (threshold {} MB)",
                    formatMb(total), formatMb(settings.getMemoryWarningThresholdBytes()));
        } else {
            log.debug("Cache memory usage: {} MB across {} entries", formatMb(total), stamped.getCacheEntryCount());
        }
    }

    public StatsSnapshot getStats() {
        lock.lock();
        try {
            purgeExpired();

            StatsSnapshot.StatsSnapshotBuilder snapshot = StatsSnapshot.builder()
                    .timestamp(clock.instant())
                    .retentionHours(settings.getRetentionHours())
                    .hitRate(hitRate())
                    .hits(hits)
                    .misses(misses)
                    .totalOperations(totalOperations);
            for (OperationCategory category : OperationCategory.values()) {
                snapshot.categoryStats(category, categoryStats(measurements.get(category)));
            }
            return snapshot
                    .compression(compressionStats())
                    .memory(memoryStats())
                    .invalidation(invalidationStats())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public double getHitRate() {
        lock.lock();
        try {
            return hitRate();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Operations whose duration exceeds {@code thresholdMultiplier} times the mean of their
     * own category. Every category is present in the result, possibly with an empty list.
     */
    public Map<OperationCategory, List<SlowOperation>> getSlowOperations(double thresholdMultiplier) {
        if (thresholdMultiplier <= 0) {
            throw new IllegalArgumentException("thresholdMultiplier must be positive");
        }
        lock.lock();
        try {
            purgeExpired();
            Map<OperationCategory, List<SlowOperation>> result = new EnumMap<>(OperationCategory.class);
            for (OperationCategory category : OperationCategory.values()) {
                Deque<PerformanceMeasurement> series = measurements.get(category);
                if (series.isEmpty()) {
                    result.put(category, List.of());
                    continue;
                }
                double average = series.stream().mapToDouble(PerformanceMeasurement::getDurationMillis).average().orElse(0);
                double threshold = average * thresholdMultiplier;
                List<SlowOperation> slow = series.stream()
                        .filter(m -> m.getDurationMillis() > threshold)
                        .map(m -> new SlowOperation(m, average))
                        .collect(Collectors.toUnmodifiableList());
                result.put(category, slow);
            }
            return Collections.unmodifiableMap(result);
        } finally {
            lock.unlock();
        }
    }

    public Map<OperationCategory, List<SlowOperation>> getSlowOperations() {
        return getSlowOperations(2.0);
    }

    public List<MonitoringAlert> getMemoryWarnings() {
        lock.lock();
        try {
            purgeExpired();
            if (memorySamples.isEmpty()) {
                return List.of();
            }
            MemoryUsageSample latest = memorySamples.getLast();
            MemoryStats memory = memoryStats();
            List<MonitoringAlert> warnings = new ArrayList<>();

            long total = latest.getTotalCacheSizeBytes();
            if (total >= settings.getMemoryCriticalThresholdBytes()) {
                warnings.add(MonitoringAlert.builder()
                        .severity(Severity.CRITICAL)
                        .issue("Critical memory usage")
                        .message(String.format("Cache memory usage is %sMB, exceeding critical threshold of %sMB",
                                formatMb(total), formatMb(settings.getMemoryCriticalThresholdBytes())))
                        .suggestion("Reduce cache TTL values")
                        .suggestion("Apply more aggressive eviction to the memory tier")
                        .suggestion("Review and shrink large cached responses")
                        .suggestion("Increase memory limits or scale horizontally")
                        .build());
            } else if (total >= settings.getMemoryWarningThresholdBytes()) {
                warnings.add(MonitoringAlert.builder()
                        .severity(Severity.WARNING)
                        .issue("High memory usage")
                        .message(String.format("Cache memory usage is %sMB, exceeding warning threshold of %sMB",
                                formatMb(total), formatMb(settings.getMemoryWarningThresholdBytes())))
                        .suggestion("Monitor cache growth closely")
                        .suggestion("Review cache key patterns for optimization")
                        .suggestion("Consider reducing the memory cache size limit")
                        .build());
            } else if (memory.getHoursUntilWarning() != null && memory.getHoursUntilWarning() < GROWTH_ALERT_HOURS) {
                warnings.add(MonitoringAlert.builder()
                        .severity(Severity.WARNING)
                        .issue("Memory growth")
                        .message(String.format("Cache memory is growing by %sMB/hour and will reach the warning threshold in %.1f hours",
                                formatMb((long) memory.getGrowthRateBytesPerHour()), memory.getHoursUntilWarning()))
                        .suggestion("Check for keys written without a TTL or with very long TTLs")
                        .suggestion("Review whether large payloads are being cached unintentionally")
                        .build());
            }

            if (latest.getMemoryTierCapacity() > 0 && latest.getMemoryTierEntries() > 0) {
                double utilization = latest.getMemoryTierEntries() * 100.0 / latest.getMemoryTierCapacity();
                if (utilization > MEMORY_TIER_FULL_PERCENT) {
                    warnings.add(MonitoringAlert.builder()
                            .severity(Severity.INFO)
                            .issue("Memory tier nearly full")
                            .message(String.format("Memory cache is %.1f%% full (%d/%d entries)",
                                    utilization, latest.getMemoryTierEntries(), latest.getMemoryTierCapacity()))
                            .suggestion("Eviction is active; increase memoryCacheSize if hit rates are good")
                            .build());
                }
            }

            warnings.sort(Comparator.comparing(MonitoringAlert::getSeverity));
            return List.copyOf(warnings);
        } finally {
            lock.unlock();
        }
    }

    public List<MonitoringAlert> getInvalidationRecommendations() {
        lock.lock();
        try {
            purgeExpired();
            Deque<PerformanceMeasurement> events = measurements.get(OperationCategory.INVALIDATION);
            if (events.isEmpty()) {
                return List.of();
            }
            InvalidationStats stats = invalidationStats();
            List<MonitoringAlert> recommendations = new ArrayList<>();

            if (stats.getLastHour() >= settings.getInvalidationWarningPerHour()) {
                boolean critical = stats.getLastHour() >= settings.getInvalidationCriticalPerHour();
                recommendations.add(MonitoringAlert.builder()
                        .severity(critical ? Severity.CRITICAL : Severity.WARNING)
                        .issue("High invalidation frequency")
                        .message(String.format("Cache is being invalidated %d times per hour", stats.getLastHour()))
                        .suggestion("Review invalidation triggers to reduce unnecessary clearing")
                        .suggestion("Use more specific patterns for selective invalidation")
                        .suggestion("Check whether TTL values are set too low")
                        .build());
            }

            if (events.size() >= DOMINANT_PATTERN_MIN_EVENTS && !stats.getMostCommonPatterns().isEmpty()) {
                Map.Entry<String, Long> top = stats.getMostCommonPatterns().entrySet().iterator().next();
                long windowSize = Math.min(events.size(), PATTERN_WINDOW);
                if (top.getValue() > windowSize * 0.5) {
                    recommendations.add(MonitoringAlert.builder()
                            .severity(Severity.INFO)
                            .issue("Dominant invalidation pattern")
                            .message(String.format("Pattern '%s' accounts for %d of the last %d invalidations",
                                    top.getKey(), top.getValue(), windowSize))
                            .suggestion("Optimize the operations that trigger '" + top.getKey() + "' invalidations")
                            .suggestion("Evaluate whether the pattern could be more specific")
                            .build());
                }
            }

            if (events.size() >= EFFICIENCY_MIN_EVENTS) {
                double averageKeys = events.stream().mapToInt(m -> m.getContext().getKeysAffected()).average().orElse(0);
                if (averageKeys < 1.0) {
                    recommendations.add(MonitoringAlert.builder()
                            .severity(Severity.INFO)
                            .issue("Low invalidation efficiency")
                            .message(String.format("Average of %.1f keys invalidated per operation", averageKeys))
                            .suggestion("Many invalidations find nothing to clear; use more targeted patterns")
                            .suggestion("Review whether cache keys are structured for invalidation")
                            .build());
                } else if (averageKeys > 100.0) {
                    recommendations.add(MonitoringAlert.builder()
                            .severity(Severity.WARNING)
                            .issue("High invalidation impact")
                            .message(String.format("Average of %.0f keys invalidated per operation", averageKeys))
                            .suggestion("Use more selective patterns to preserve valid entries")
                            .suggestion("Evaluate whether smaller, more frequent invalidations would be better")
                            .build());
                }
            }

            recommendations.sort(Comparator.comparing(MonitoringAlert::getSeverity));
            return List.copyOf(recommendations);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears measurements and counters. {@link MonitorSettings} are kept.
     */
    public void reset() {
        lock.lock();
        try {
            measurements.values().forEach(Deque::clear);
            memorySamples.clear();
            hits = 0;
            misses = 0;
            totalOperations = 0;
            totalInvalidations = 0;
            totalKeysInvalidated = 0;
        } finally {
            lock.unlock();
        }
        log.info("Cache performance statistics reset");
    }

    /**
     * Raw dump of every retained measurement, suitable for JSON serialization.
     */
    public Map<String, Object> export() {
        lock.lock();
        try {
            Map<String, Object> series = new LinkedHashMap<>();
            measurements.forEach((category, values) -> series.put(category.name(),
                    values.stream().map(PerformanceMeasurement::toMap).collect(Collectors.toList())));

            Map<String, Object> dump = new LinkedHashMap<>();
            dump.put("measurements", series);
            dump.put("memoryUsage", memorySamples.stream().map(MemoryUsageSample::toMap).collect(Collectors.toList()));
            dump.put("hits", hits);
            dump.put("misses", misses);
            dump.put("totalOperations", totalOperations);
            dump.put("totalInvalidations", totalInvalidations);
            dump.put("totalKeysInvalidated", totalKeysInvalidated);
            dump.put("settings", settings.toMap());
            dump.put("exportTimestamp", clock.instant().toString());
            return dump;
        } finally {
            lock.unlock();
        }
    }

    private double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    private void purgeExpired() {
        Instant cutoff = clock.instant().minus(Duration.ofHours(settings.getRetentionHours()));
        for (Deque<PerformanceMeasurement> series : measurements.values()) {
            while (!series.isEmpty() && !series.peekFirst().getTimestamp().isAfter(cutoff)) {
                series.removeFirst();
            }
        }
        while (!memorySamples.isEmpty() && !memorySamples.peekFirst().getTimestamp().isAfter(cutoff)) {
            memorySamples.removeFirst();
        }
    }

    private <T> void trimToCapacity(Deque<T> series) {
        while (series.size() > settings.getMaxMeasurements()) {
            series.removeFirst();
        }
    }

    private static long countSince(Deque<PerformanceMeasurement> series, Instant since) {
        return series.stream().filter(m -> m.getTimestamp().isAfter(since)).count();
    }

    private static CategoryStats categoryStats(Deque<PerformanceMeasurement> series) {
        if (series.isEmpty()) {
            return CategoryStats.builder().build();
        }
        double[] durations = series.stream().mapToDouble(PerformanceMeasurement::getDurationMillis).sorted().toArray();
        int n = durations.length;
        double median = n % 2 == 1 ? durations[n / 2] : (durations[n / 2 - 1] + durations[n / 2]) / 2.0;
        double sum = 0;
        for (double d : durations) {
            sum += d;
        }
        return CategoryStats.builder()
                .count(n)
                .failures(series.stream().filter(m -> !m.getContext().isSuccess()).count())
                .averageMillis(sum / n)
                .medianMillis(median)
                .minMillis(durations[0])
                .maxMillis(durations[n - 1])
                .build();
    }

    private CompressionStats compressionStats() {
        List<MeasurementContext> compressions = measurements.get(OperationCategory.COMPRESSION).stream()
                .map(PerformanceMeasurement::getContext)
                .filter(c -> c.getCompressionRatio() != null)
                .collect(Collectors.toList());
        if (compressions.isEmpty()) {
            return CompressionStats.builder().build();
        }
        double[] ratios = compressions.stream().mapToDouble(MeasurementContext::getCompressionRatio).toArray();
        long original = compressions.stream().mapToLong(MeasurementContext::getOriginalSize).sum();
        long compressed = compressions.stream().mapToLong(MeasurementContext::getCompressedSize).sum();
        long saved = original - compressed;
        double average = 0;
        double best = Double.MAX_VALUE;
        double worst = 0;
        for (double ratio : ratios) {
            average += ratio;
            best = Math.min(best, ratio);
            worst = Math.max(worst, ratio);
        }
        return CompressionStats.builder()
                .operations(compressions.size())
                .averageRatio(average / ratios.length)
                .bestRatio(best)
                .worstRatio(worst)
                .totalBytesProcessed(original)
                .totalBytesSaved(saved)
                .savingsPercent(original > 0 ? saved * 100.0 / original : 0)
                .build();
    }

    private MemoryStats memoryStats() {
        MemoryStats.MemoryStatsBuilder stats = MemoryStats.builder()
                .warningThresholdBytes(settings.getMemoryWarningThresholdBytes())
                .criticalThresholdBytes(settings.getMemoryCriticalThresholdBytes());
        if (memorySamples.isEmpty()) {
            return stats.measured(false).build();
        }

        MemoryUsageSample latest = memorySamples.getLast();
        long current = latest.getTotalCacheSizeBytes();
        stats.measured(true)
                .currentBytes(current)
                .entryCount(latest.getCacheEntryCount())
                .memoryTierEntries(latest.getMemoryTierEntries())
                .memoryTierCapacity(latest.getMemoryTierCapacity())
                .utilizationPercent(current * 100.0 / settings.getMemoryWarningThresholdBytes())
                .warningThresholdReached(current >= settings.getMemoryWarningThresholdBytes())
                .criticalThresholdReached(current >= settings.getMemoryCriticalThresholdBytes());

        List<MemoryUsageSample> window = new ArrayList<>(memorySamples);
        window = window.subList(Math.max(0, window.size() - TREND_WINDOW), window.size());
        if (window.size() >= 2) {
            MemoryUsageSample first = window.get(0);
            double hours = Duration.between(first.getTimestamp(), latest.getTimestamp()).toMillis() / 3_600_000.0;
            if (hours > 0) {
                double growth = (current - first.getTotalCacheSizeBytes()) / hours;
                stats.growthRateBytesPerHour(growth)
                        .hoursUntilWarning(hoursUntil(current, settings.getMemoryWarningThresholdBytes(), growth))
                        .hoursUntilCritical(hoursUntil(current, settings.getMemoryCriticalThresholdBytes(), growth));
            }
        }
        return stats.build();
    }

    private static Double hoursUntil(long current, long threshold, double growthPerHour) {
        if (growthPerHour <= 0 || current >= threshold) {
            return null;
        }
        return (threshold - current) / growthPerHour;
    }

    private InvalidationStats invalidationStats() {
        Deque<PerformanceMeasurement> events = measurements.get(OperationCategory.INVALIDATION);
        Instant now = clock.instant();
        long lastHour = countSince(events, now.minus(Duration.ofHours(1)));
        long last24Hours = countSince(events, now.minus(Duration.ofHours(24)));

        String alertLevel = "normal";
        if (lastHour >= settings.getInvalidationCriticalPerHour()) {
            alertLevel = "critical";
        } else if (lastHour >= settings.getInvalidationWarningPerHour()) {
            alertLevel = "warning";
        }

        List<PerformanceMeasurement> recent = new ArrayList<>(events);
        recent = recent.subList(Math.max(0, recent.size() - PATTERN_WINDOW), recent.size());

        return InvalidationStats.builder()
                .totalInvalidations(totalInvalidations)
                .totalKeysInvalidated(totalKeysInvalidated)
                .lastHour(lastHour)
                .last24Hours(last24Hours)
                .averagePerHour((double) events.size() / settings.getRetentionHours())
                .alertLevel(alertLevel)
                .averageKeysPerInvalidation(totalInvalidations > 0 ? (double) totalKeysInvalidated / totalInvalidations : 0)
                .mostCommonPatterns(countByDescending(recent, c -> c.getPattern(), TOP_PATTERNS))
                .invalidationTypes(countByDescending(recent, c -> c.getInvalidationType(), Integer.MAX_VALUE))
                .build();
    }

    private static Map<String, Long> countByDescending(List<PerformanceMeasurement> events,
                                                       Function<MeasurementContext, String> classifier,
                                                       int limit) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (PerformanceMeasurement event : events) {
            String value = classifier.apply(event.getContext());
            counts.merge(value != null ? value : "unknown", 1L, Long::sum);
        }
        // stable sort keeps first-seen order among equal counts
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(limit)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }

    private void logIfSlow(PerformanceMeasurement measurement) {
        long threshold = measurement.getCategory() == OperationCategory.KEY_GENERATION
                ? settings.getSlowKeyGenerationMillis()
                : settings.getSlowCacheOperationMillis();
        if (measurement.getDurationMillis() > threshold) {
            log.warn("Slow {} operation: {} ms (threshold {} ms, operation: {})",
                    measurement.getCategory(), String.format("%.1f", measurement.getDurationMillis()),
                    threshold, measurement.getContext().getOperation());
        }
    }

    private void logInvalidationRate(long lastHour, MeasurementContext context) {
        if (lastHour >= settings.getInvalidationCriticalPerHour()) {
            log.error("Critical invalidation rate: {} invalidations in the last hour (threshold {})",
                    lastHour, settings.getInvalidationCriticalPerHour());
        } else if (lastHour >= settings.getInvalidationWarningPerHour()) {
            log.warn("High invalidation rate: {} invalidations in the last hour (threshold {})",
                    lastHour, settings.getInvalidationWarningPerHour());
        }
        log.debug("Cache invalidation: pattern='{}', keys={}, type={}",
                context.getPattern(), context.getKeysAffected(), context.getInvalidationType());
    }

    private static String formatMb(long bytes) {
        return String.format("%.1f", bytes / BYTES_PER_MB);
    }
}
