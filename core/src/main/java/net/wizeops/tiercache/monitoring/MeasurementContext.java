package net.wizeops.tiercache.monitoring;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Category-specific details attached to a {@link PerformanceMeasurement}. Fields that do
 * not apply to a category are left at their defaults.
 */
@Value
@Builder(toBuilder = true)
public class MeasurementContext {
    public static final MeasurementContext EMPTY = MeasurementContext.builder().build();

    String operation;
    @Builder.Default
    boolean success = true;
    /** {@code null} for anything that is not a lookup. */
    Boolean hit;
    String tier;
    int textLength;
    String textTier;
    long originalSize;
    long compressedSize;
    Double compressionRatio;
    int keysAffected;
    String pattern;
    String invalidationType;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("operation", operation);
        map.put("success", success);
        map.put("hit", hit);
        map.put("tier", tier);
        map.put("textLength", textLength);
        map.put("textTier", textTier);
        map.put("originalSize", originalSize);
        map.put("compressedSize", compressedSize);
        map.put("compressionRatio", compressionRatio);
        map.put("keysAffected", keysAffected);
        map.put("pattern", pattern);
        map.put("invalidationType", invalidationType);
        return map;
    }
}
