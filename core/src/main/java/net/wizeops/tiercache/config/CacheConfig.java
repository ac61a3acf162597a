package net.wizeops.tiercache.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import net.wizeops.tiercache.exceptions.ConfigurationException;
import net.wizeops.tiercache.security.SecurityConfig;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable cache configuration. Obtain a builder seeded with strategy defaults from
 * {@link #forStrategy(CacheStrategy)}, override what differs, then {@link #validate()}.
 */
@Value
@Builder(toBuilder = true)
public class CacheConfig {
    public static final int MIN_TTL_SECONDS = 60;
    public static final int MAX_TTL_SECONDS = 86_400;
    public static final int MIN_CONNECTIONS = 1;
    public static final int MAX_CONNECTIONS = 100;
    public static final int MIN_TIMEOUT_SECONDS = 1;
    public static final int MAX_TIMEOUT_SECONDS = 30;
    public static final int MIN_COMPRESSION_THRESHOLD = 1024;
    public static final int MAX_COMPRESSION_THRESHOLD = 65_536;
    public static final int MIN_COMPRESSION_LEVEL = 1;
    public static final int MAX_COMPRESSION_LEVEL = 9;
    public static final int MIN_MEMORY_CACHE_SIZE = 1;
    public static final int MAX_MEMORY_CACHE_SIZE = 10_000;
    public static final int MIN_TEXT_HASH_THRESHOLD = 100;
    public static final int MAX_TEXT_HASH_THRESHOLD = 10_000;

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Set<String> KNOWN_KEYS = Set.of("strategy", "remoteUrl", "defaultTtlSeconds",
            "maxConnections", "connectionTimeoutSeconds", "compressionThresholdBytes", "compressionLevel",
            "memoryCacheSize", "enableAiFeatures", "textHashThreshold", "failOnConnectionError",
            "operationTtls", "securityConfig");

    @Builder.Default
    CacheStrategy strategy = CacheStrategy.BALANCED;

    String remoteUrl;

    @Builder.Default
    int defaultTtlSeconds = 3600;

    @Builder.Default
    int maxConnections = 10;

    @Builder.Default
    int connectionTimeoutSeconds = 5;

    @Builder.Default
    int compressionThresholdBytes = 1024;

    @Builder.Default
    int compressionLevel = 6;

    @Builder.Default
    int memoryCacheSize = 100;

    boolean enableAiFeatures;

    @Builder.Default
    int textHashThreshold = 1000;

    boolean failOnConnectionError;

    @Singular
    Map<String, Integer> operationTtls;

    SecurityConfig securityConfig;

    /**
     * Builder pre-populated with the defaults of {@code strategy}.
     */
    public static CacheConfigBuilder forStrategy(CacheStrategy strategy) {
        CacheConfigBuilder builder = CacheConfig.builder().strategy(strategy);
        return switch (strategy) {
            case FAST -> builder
                    .defaultTtlSeconds(600)
                    .maxConnections(3)
                    .connectionTimeoutSeconds(2)
                    .compressionThresholdBytes(2048)
                    .compressionLevel(3)
                    .memoryCacheSize(50);
            case BALANCED -> builder
                    .defaultTtlSeconds(3600)
                    .maxConnections(10)
                    .connectionTimeoutSeconds(5)
                    .compressionThresholdBytes(1024)
                    .compressionLevel(6)
                    .memoryCacheSize(100);
            case ROBUST -> builder
                    .defaultTtlSeconds(7200)
                    .maxConnections(20)
                    .connectionTimeoutSeconds(10)
                    .compressionThresholdBytes(1024)
                    .compressionLevel(9)
                    .memoryCacheSize(500);
            case AI_OPTIMIZED -> builder
                    .defaultTtlSeconds(14_400)
                    .maxConnections(25)
                    .connectionTimeoutSeconds(15)
                    .compressionThresholdBytes(1024)
                    .compressionLevel(9)
                    .memoryCacheSize(1000)
                    .enableAiFeatures(true)
                    .textHashThreshold(1000)
                    .operationTtl("summarize", 14_400)
                    .operationTtl("sentiment", 7200)
                    .operationTtl("key_points", 10_800)
                    .operationTtl("questions", 9600)
                    .operationTtl("qa", 7200);
        };
    }

    public static CacheConfig defaults(CacheStrategy strategy) {
        return forStrategy(strategy).build();
    }

    public Duration getDefaultTtl() {
        return Duration.ofSeconds(defaultTtlSeconds);
    }

    public Duration getConnectionTimeout() {
        return Duration.ofSeconds(connectionTimeoutSeconds);
    }

    /**
     * TTL configured for an AI operation, or the default TTL when none is set.
     */
    public Duration ttlForOperation(String operation) {
        Integer seconds = operation != null ? operationTtls.get(operation) : null;
        return Duration.ofSeconds(seconds != null ? seconds : defaultTtlSeconds);
    }

    public boolean hasRemote() {
        return remoteUrl != null && !remoteUrl.isBlank();
    }

    public boolean isTlsRequested() {
        return (securityConfig != null && securityConfig.isTlsEnabled())
                || (remoteUrl != null && remoteUrl.startsWith("rediss://"));
    }

    public ValidationResult validate() {
        ValidationResult.ValidationResultBuilder result = ValidationResult.builder();

        if (strategy == null) {
            result.error("strategy: required");
        }
        checkRange(result, "defaultTtlSeconds", defaultTtlSeconds, MIN_TTL_SECONDS, MAX_TTL_SECONDS);
        checkRange(result, "maxConnections", maxConnections, MIN_CONNECTIONS, MAX_CONNECTIONS);
        checkRange(result, "connectionTimeoutSeconds", connectionTimeoutSeconds, MIN_TIMEOUT_SECONDS, MAX_TIMEOUT_SECONDS);
        checkRange(result, "compressionThresholdBytes", compressionThresholdBytes, MIN_COMPRESSION_THRESHOLD, MAX_COMPRESSION_THRESHOLD);
        checkRange(result, "compressionLevel", compressionLevel, MIN_COMPRESSION_LEVEL, MAX_COMPRESSION_LEVEL);
        checkRange(result, "memoryCacheSize", memoryCacheSize, MIN_MEMORY_CACHE_SIZE, MAX_MEMORY_CACHE_SIZE);
        checkRange(result, "textHashThreshold", textHashThreshold, MIN_TEXT_HASH_THRESHOLD, MAX_TEXT_HASH_THRESHOLD);

        if (strategy == CacheStrategy.AI_OPTIMIZED && !enableAiFeatures) {
            result.error("enableAiFeatures: must be true when strategy is ai_optimized");
        }
        if (enableAiFeatures && operationTtls.isEmpty()) {
            result.warning("operationTtls: AI features are enabled but no per-operation TTLs are configured");
        }
        operationTtls.forEach((operation, ttl) -> {
            if (operation == null || operation.isBlank()) {
                result.error("operationTtls: operation names must not be blank");
            } else if (ttl == null) {
                result.error("operationTtls." + operation + ": TTL is required");
            } else {
                checkRange(result, "operationTtls." + operation, ttl, MIN_TTL_SECONDS, MAX_TTL_SECONDS);
            }
        });

        if (remoteUrl != null) {
            validateRemoteUrl(result);
        }
        ValidationResult outcome = result.build();
        if (securityConfig != null) {
            outcome = outcome.merge(securityConfig.validate());
        }
        return outcome;
    }

    /**
     * @throws ConfigurationException listing every error when the configuration is invalid
     */
    public CacheConfig validateOrThrow() {
        ValidationResult result = validate();
        if (!result.isValid()) {
            throw new ConfigurationException("Invalid cache configuration: " + String.join("; ", result.getErrors()),
                    result.getErrors());
        }
        return this;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("strategy", strategy != null ? strategy.getValue() : null);
        if (remoteUrl != null) {
            map.put("remoteUrl", remoteUrl);
        }
        map.put("defaultTtlSeconds", defaultTtlSeconds);
        map.put("maxConnections", maxConnections);
        map.put("connectionTimeoutSeconds", connectionTimeoutSeconds);
        map.put("compressionThresholdBytes", compressionThresholdBytes);
        map.put("compressionLevel", compressionLevel);
        map.put("memoryCacheSize", memoryCacheSize);
        map.put("enableAiFeatures", enableAiFeatures);
        map.put("textHashThreshold", textHashThreshold);
        map.put("failOnConnectionError", failOnConnectionError);
        map.put("operationTtls", new TreeMap<>(operationTtls));
        if (securityConfig != null) {
            map.put("securityConfig", securityConfig.toMap());
        }
        return map;
    }

    /**
     * Builds a configuration from a structured map. Fields that are absent take the
     * defaults of the map's {@code strategy} (balanced when absent).
     *
     * @throws ConfigurationException naming every unknown or malformed field
     */
    public static CacheConfig fromMap(Map<String, ?> map) {
        if (map == null) {
            throw new ConfigurationException("configuration: map is required");
        }
        return applyOverrides(null, map);
    }

    /**
     * Applies the fields present in {@code overrides} on top of {@code base}. A
     * {@code strategy} override re-seeds all strategy defaults first.
     */
    public static CacheConfig applyOverrides(CacheConfig base, Map<String, ?> overrides) {
        List<String> errors = new ArrayList<>();
        overrides.keySet().stream()
                .filter(key -> !KNOWN_KEYS.contains(key))
                .sorted()
                .forEach(key -> errors.add(key + ": unknown configuration field"));

        CacheConfigBuilder builder;
        if (overrides.containsKey("strategy")) {
            CacheStrategy strategy = null;
            try {
                strategy = CacheStrategy.fromValue(asString(overrides.get("strategy"), "strategy"));
            } catch (ConfigurationException e) {
                errors.add(e.getMessage());
            }
            builder = forStrategy(strategy != null ? strategy : CacheStrategy.BALANCED);
            if (base != null) {
                builder.remoteUrl(base.remoteUrl)
                        .failOnConnectionError(base.failOnConnectionError)
                        .securityConfig(base.securityConfig);
            }
        } else {
            builder = base != null ? base.toBuilder() : forStrategy(CacheStrategy.BALANCED);
        }

        if (overrides.containsKey("remoteUrl")) {
            collect(errors, () -> builder.remoteUrl(asString(overrides.get("remoteUrl"), "remoteUrl")));
        }
        intField(errors, overrides, "defaultTtlSeconds", builder::defaultTtlSeconds);
        intField(errors, overrides, "maxConnections", builder::maxConnections);
        intField(errors, overrides, "connectionTimeoutSeconds", builder::connectionTimeoutSeconds);
        intField(errors, overrides, "compressionThresholdBytes", builder::compressionThresholdBytes);
        intField(errors, overrides, "compressionLevel", builder::compressionLevel);
        intField(errors, overrides, "memoryCacheSize", builder::memoryCacheSize);
        intField(errors, overrides, "textHashThreshold", builder::textHashThreshold);
        boolField(errors, overrides, "enableAiFeatures", builder::enableAiFeatures);
        boolField(errors, overrides, "failOnConnectionError", builder::failOnConnectionError);

        if (overrides.containsKey("operationTtls")) {
            Object raw = overrides.get("operationTtls");
            if (raw instanceof Map) {
                builder.clearOperationTtls();
                ((Map<?, ?>) raw).forEach((operation, ttl) -> {
                    if (ttl instanceof Number && isIntegral((Number) ttl)) {
                        builder.operationTtl(String.valueOf(operation), ((Number) ttl).intValue());
                    } else {
                        errors.add("operationTtls." + operation + ": expected an integer, got " + describe(ttl));
                    }
                });
            } else if (raw != null) {
                errors.add("operationTtls: expected a map, got " + describe(raw));
            }
        }

        if (overrides.containsKey("securityConfig")) {
            Object raw = overrides.get("securityConfig");
            if (raw == null) {
                builder.securityConfig(null);
            } else if (raw instanceof Map) {
                @SuppressWarnings("unchecked")
                Map<String, ?> security = (Map<String, ?>) raw;
                collect(errors, () -> builder.securityConfig(SecurityConfig.fromMap(security)));
            } else {
                errors.add("securityConfig: expected a map, got " + describe(raw));
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException("Malformed cache configuration: " + String.join("; ", errors), errors);
        }
        return builder.build();
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toMap());
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Failed to serialize cache configuration", e);
        }
    }

    public static CacheConfig fromJson(String json) {
        return fromMap(parseJsonObject(json, "configuration"));
    }

    static Map<String, Object> parseJsonObject(String json, String field) {
        try {
            Map<String, Object> map = MAPPER.readValue(json, new TypeReference<Map<String, Object>>() {
            });
            if (map == null) {
                throw new ConfigurationException(field + ": expected a JSON object");
            }
            return map;
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(field + ": invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private void validateRemoteUrl(ValidationResult.ValidationResultBuilder result) {
        if (remoteUrl.isBlank()) {
            result.error("remoteUrl: must not be blank");
            return;
        }
        if (!remoteUrl.startsWith("redis://") && !remoteUrl.startsWith("rediss://")) {
            result.error("remoteUrl: must start with redis:// or rediss://");
            return;
        }
        try {
            URI uri = new URI(remoteUrl);
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                result.error("remoteUrl: must include a host");
            }
        } catch (URISyntaxException e) {
            result.error("remoteUrl: malformed URL: " + e.getReason());
        }
        if (remoteUrl.startsWith("rediss://") && (securityConfig == null || !securityConfig.isTlsEnabled())) {
            result.warning("remoteUrl: rediss:// is used but securityConfig.tlsEnabled is false, the JVM default trust store applies");
        }
    }

    private static void checkRange(ValidationResult.ValidationResultBuilder result, String field, int value, int min, int max) {
        if (value < min || value > max) {
            result.error(String.format("%s: %d is outside the allowed range %d-%d", field, value, min, max));
        }
    }

    private interface IntSetter {
        void set(int value);
    }

    private interface BoolSetter {
        void set(boolean value);
    }

    private static void intField(List<String> errors, Map<String, ?> map, String key, IntSetter setter) {
        if (!map.containsKey(key)) {
            return;
        }
        Object value = map.get(key);
        if (value instanceof Number && isIntegral((Number) value)) {
            setter.set(((Number) value).intValue());
        } else if (value instanceof String) {
            try {
                setter.set(Integer.parseInt(((String) value).trim()));
            } catch (NumberFormatException e) {
                errors.add(key + ": expected an integer, got '" + value + "'");
            }
        } else {
            errors.add(key + ": expected an integer, got " + describe(value));
        }
    }

    private static void boolField(List<String> errors, Map<String, ?> map, String key, BoolSetter setter) {
        if (!map.containsKey(key)) {
            return;
        }
        Object value = map.get(key);
        if (value instanceof Boolean) {
            setter.set((Boolean) value);
        } else if (value instanceof String) {
            collect(errors, () -> setter.set(SecurityConfig.parseBoolean(key, (String) value, false)));
        } else {
            errors.add(key + ": expected a boolean, got " + describe(value));
        }
    }

    private static void collect(List<String> errors, Runnable action) {
        try {
            action.run();
        } catch (ConfigurationException e) {
            errors.add(e.getMessage());
        }
    }

    private static String asString(Object value, String field) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new ConfigurationException(field + ": expected a string, got " + describe(value));
        }
        return (String) value;
    }

    private static boolean isIntegral(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            return d == Math.rint(d) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE;
        }
        long l = number.longValue();
        return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " '" + value + "'";
    }
}
