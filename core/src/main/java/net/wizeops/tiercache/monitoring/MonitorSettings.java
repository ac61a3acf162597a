package net.wizeops.tiercache.monitoring;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thresholds and retention limits of a {@link CachePerformanceMonitor}. Survives
 * {@link CachePerformanceMonitor#reset()}.
 */
@Value
@Builder(toBuilder = true)
public class MonitorSettings {
    public static final MonitorSettings DEFAULTS = MonitorSettings.builder().build();

    @Builder.Default
    int retentionHours = 1;

    @Builder.Default
    int maxMeasurements = 1000;

    @Builder.Default
    long memoryWarningThresholdBytes = 50L * 1024 * 1024;

    @Builder.Default
    long memoryCriticalThresholdBytes = 100L * 1024 * 1024;

    @Builder.Default
    int invalidationWarningPerHour = 50;

    @Builder.Default
    int invalidationCriticalPerHour = 100;

    @Builder.Default
    long slowKeyGenerationMillis = 100;

    @Builder.Default
    long slowCacheOperationMillis = 50;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("retentionHours", retentionHours);
        map.put("maxMeasurements", maxMeasurements);
        map.put("memoryWarningThresholdBytes", memoryWarningThresholdBytes);
        map.put("memoryCriticalThresholdBytes", memoryCriticalThresholdBytes);
        map.put("invalidationWarningPerHour", invalidationWarningPerHour);
        map.put("invalidationCriticalPerHour", invalidationCriticalPerHour);
        map.put("slowKeyGenerationMillis", slowKeyGenerationMillis);
        map.put("slowCacheOperationMillis", slowCacheOperationMillis);
        return map;
    }
}
