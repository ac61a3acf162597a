package net.wizeops.tiercache.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named, fully-resolved configuration: a strategy plus environment specific overrides.
 */
@Value
@Builder
public class CachePreset {
    String name;
    String displayName;
    String description;
    @Singular
    List<String> environmentContexts;
    CacheConfig config;

    /**
     * Copy of the preset configuration, for further overrides.
     */
    public CacheConfig.CacheConfigBuilder toConfigBuilder() {
        return config.toBuilder();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("displayName", displayName);
        map.put("description", description);
        map.put("environmentContexts", environmentContexts);
        map.put("config", config.toMap());
        return map;
    }
}
