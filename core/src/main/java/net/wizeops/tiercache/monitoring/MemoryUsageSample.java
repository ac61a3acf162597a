package net.wizeops.tiercache.monitoring;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time memory footprint of a cache. {@code totalCacheSizeBytes} covers both
 * tiers when the remote store reports its usage, otherwise only the memory tier.
 */
@Value
@Builder(toBuilder = true)
public class MemoryUsageSample {
    long totalCacheSizeBytes;
    long cacheEntryCount;
    long memoryTierBytes;
    int memoryTierEntries;
    int memoryTierCapacity;
    Instant timestamp;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("totalCacheSizeBytes", totalCacheSizeBytes);
        map.put("cacheEntryCount", cacheEntryCount);
        map.put("memoryTierBytes", memoryTierBytes);
        map.put("memoryTierEntries", memoryTierEntries);
        map.put("memoryTierCapacity", memoryTierCapacity);
        map.put("timestamp", timestamp != null ? timestamp.toString() : null);
        return map;
    }
}
