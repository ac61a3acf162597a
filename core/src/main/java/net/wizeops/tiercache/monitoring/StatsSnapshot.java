package net.wizeops.tiercache.monitoring;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregated view over the retained measurements. Every section is populated even when
 * nothing has been recorded yet, with zero counts and empty collections.
 */
@Value
@Builder
public class StatsSnapshot {
    Instant timestamp;
    int retentionHours;
    double hitRate;
    long hits;
    long misses;
    long totalOperations;
    @Singular("categoryStats")
    Map<OperationCategory, CategoryStats> categories;
    CompressionStats compression;
    MemoryStats memory;
    InvalidationStats invalidation;

    @Value
    @Builder
    public static class CategoryStats {
        long count;
        long failures;
        double averageMillis;
        double medianMillis;
        double minMillis;
        double maxMillis;
    }

    @Value
    @Builder
    public static class CompressionStats {
        long operations;
        double averageRatio;
        double bestRatio;
        double worstRatio;
        long totalBytesProcessed;
        long totalBytesSaved;
        double savingsPercent;
    }

    @Value
    @Builder
    public static class MemoryStats {
        boolean measured;
        long currentBytes;
        long entryCount;
        int memoryTierEntries;
        int memoryTierCapacity;
        long warningThresholdBytes;
        long criticalThresholdBytes;
        double utilizationPercent;
        boolean warningThresholdReached;
        boolean criticalThresholdReached;
        double growthRateBytesPerHour;
        /** {@code null} when usage is flat, shrinking, or already past the threshold. */
        Double hoursUntilWarning;
        Double hoursUntilCritical;
    }

    @Value
    @Builder
    public static class InvalidationStats {
        long totalInvalidations;
        long totalKeysInvalidated;
        long lastHour;
        long last24Hours;
        double averagePerHour;
        String alertLevel;
        double averageKeysPerInvalidation;
        Map<String, Long> mostCommonPatterns;
        Map<String, Long> invalidationTypes;
    }
}
