package net.wizeops.tiercache.management;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health snapshot of one cache instance, with enough detail to explain the state.
 */
@Value
@Builder
public class HealthReport {
    HealthState status;
    String providerName;
    boolean remoteConfigured;
    boolean remoteActive;
    boolean probeSucceeded;
    String probeMethod;
    long probeMillis;
    @Singular
    List<String> messages;
    Instant timestamp;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status.getValue());
        map.put("providerName", providerName);
        map.put("remoteConfigured", remoteConfigured);
        map.put("remoteActive", remoteActive);
        map.put("probeSucceeded", probeSucceeded);
        map.put("probeMethod", probeMethod);
        map.put("probeMillis", probeMillis);
        map.put("messages", messages);
        map.put("timestamp", timestamp.toString());
        return map;
    }
}
