package net.wizeops.tiercache.config;

import lombok.extern.slf4j.Slf4j;
import net.wizeops.tiercache.exceptions.ConfigurationException;
import net.wizeops.tiercache.security.SecurityConfig;

import java.util.Map;

/**
 * Resolves a {@link CacheConfig} from environment variables.
 * <p>
 * Precedence, lowest first: the {@code CACHE_PRESET} preset, then the
 * {@code CACHE_REDIS_URL} and {@code ENABLE_AI_CACHE} overrides, then the
 * {@code CACHE_CUSTOM_CONFIG} JSON object. Security settings come from the
 * {@code REDIS_*} variables and apply unless the custom JSON sets its own.
 */
@Slf4j
public class CacheConfigLoader {
    public static final String CACHE_PRESET = "CACHE_PRESET";
    public static final String CACHE_REDIS_URL = "CACHE_REDIS_URL";
    public static final String ENABLE_AI_CACHE = "ENABLE_AI_CACHE";
    public static final String CACHE_CUSTOM_CONFIG = "CACHE_CUSTOM_CONFIG";

    private final CachePresetManager presetManager;

    public CacheConfigLoader() {
        this(new CachePresetManager());
    }

    public CacheConfigLoader(CachePresetManager presetManager) {
        this.presetManager = presetManager;
    }

    public CacheConfig fromSystemEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * @throws ConfigurationException when a variable is malformed or the result fails validation
     */
    public CacheConfig fromEnvironment(Map<String, String> env) {
        String presetName = valueOrDefault(env.get(CACHE_PRESET), CachePresetManager.DEFAULT_PRESET);
        CacheConfig.CacheConfigBuilder builder = presetManager.getPreset(presetName).toConfigBuilder();

        String redisUrl = env.get(CACHE_REDIS_URL);
        if (redisUrl != null && !redisUrl.isBlank()) {
            if ("disabled".equals(presetName.trim())) {
                log.warn("Ignoring {} because the disabled preset runs memory-only", CACHE_REDIS_URL);
            } else {
                builder.remoteUrl(redisUrl.trim());
            }
        }

        String enableAi = env.get(ENABLE_AI_CACHE);
        if (enableAi != null && !enableAi.isBlank()) {
            builder.enableAiFeatures(SecurityConfig.parseBoolean(ENABLE_AI_CACHE, enableAi, false));
        }

        SecurityConfig security = SecurityConfig.fromEnvironment(env);
        if (security != null) {
            builder.securityConfig(security);
        }

        CacheConfig config = builder.build();
        String custom = env.get(CACHE_CUSTOM_CONFIG);
        if (custom != null && !custom.isBlank()) {
            Map<String, Object> overrides = CacheConfig.parseJsonObject(custom, CACHE_CUSTOM_CONFIG);
            config = CacheConfig.applyOverrides(config, overrides);
        }

        config.validateOrThrow();
        log.info("Resolved cache configuration from preset '{}' (strategy {}, remote {})",
                presetName, config.getStrategy().getValue(), config.hasRemote() ? "configured" : "none");
        return config;
    }

    private static String valueOrDefault(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }
}
