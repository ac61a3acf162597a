package net.wizeops.tiercache.monitoring;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class PerformanceMeasurement {
    OperationCategory category;
    Duration duration;
    Instant timestamp;
    @Builder.Default
    MeasurementContext context = MeasurementContext.EMPTY;

    public double getDurationMillis() {
        return duration.toNanos() / 1_000_000.0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("category", category.name());
        map.put("durationMillis", getDurationMillis());
        map.put("timestamp", timestamp.toString());
        map.put("context", context.toMap());
        return map;
    }
}
