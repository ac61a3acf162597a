package net.wizeops.tiercache.manager;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class CleanupReport {
    int cleaned;
    int remaining;
    Duration duration;
    @Singular
    List<String> errors;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("cleaned", cleaned);
        map.put("remaining", remaining);
        map.put("durationMillis", duration.toMillis());
        map.put("errors", errors);
        return map;
    }
}
