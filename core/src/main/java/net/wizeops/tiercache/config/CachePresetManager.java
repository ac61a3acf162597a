package net.wizeops.tiercache.config;

import lombok.extern.slf4j.Slf4j;
import net.wizeops.tiercache.exceptions.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Registry of the built-in presets, with environment based recommendation.
 */
@Slf4j
public class CachePresetManager {
    public static final String DEFAULT_PRESET = "development";

    private static final Map<String, EnvironmentRecommendation> EXACT_MATCHES = new LinkedHashMap<>();
    private static final List<Pattern> AI_PRODUCTION_PATTERNS = patterns("ai.*prod", "ai.*live");
    private static final List<Pattern> STAGING_PATTERNS = patterns("stag", "pre-?prod", "uat", "integration");
    private static final List<Pattern> DEVELOPMENT_PATTERNS = patterns("dev", "local", "test", "sandbox", "demo");
    private static final List<Pattern> PRODUCTION_PATTERNS = patterns("prod", "live", "release", "stable", "main", "master");

    static {
        exact("development", "development", 0.95, "Exact match for development environment");
        exact("dev", "development", 0.90, "Standard abbreviation for development");
        exact("testing", "development", 0.85, "Testing uses development-like settings");
        exact("test", "development", 0.85, "Test environment should fail fast");
        exact("staging", "production", 0.90, "Staging mirrors production settings");
        exact("stage", "production", 0.85, "Stage environment abbreviation");
        exact("production", "production", 0.95, "Exact match for production environment");
        exact("prod", "production", 0.90, "Standard abbreviation for production");
        exact("live", "production", 0.85, "Live environment implies production");
        exact("ai-development", "ai-development", 0.95, "Exact match for AI development");
        exact("ai-dev", "ai-development", 0.90, "AI development abbreviation");
        exact("ai-production", "ai-production", 0.95, "Exact match for AI production");
        exact("ai-prod", "ai-production", 0.90, "AI production abbreviation");
    }

    private final Map<String, CachePreset> presets;

    public CachePresetManager() {
        Map<String, CachePreset> builtIn = new LinkedHashMap<>();
        for (CachePreset preset : builtInPresets()) {
            builtIn.put(preset.getName(), preset);
        }
        this.presets = Collections.unmodifiableMap(builtIn);
        log.debug("Initialized preset manager with {} presets", presets.size());
    }

    /**
     * @throws ConfigurationException naming the {@code preset} field when the name is unknown
     */
    public CachePreset getPreset(String name) {
        CachePreset preset = name != null ? presets.get(name.trim().toLowerCase(Locale.ROOT)) : null;
        if (preset == null) {
            throw new ConfigurationException("preset: unknown preset '" + name + "', available presets are " + listPresets(),
                    List.of("preset: unknown preset '" + name + "'"));
        }
        return preset;
    }

    public CacheConfig getConfig(String name) {
        return getPreset(name).getConfig();
    }

    public List<String> listPresets() {
        return new ArrayList<>(presets.keySet());
    }

    public Map<String, CachePreset> getAllPresets() {
        return presets;
    }

    public String recommendPreset(String environment) {
        return recommendPresetWithDetails(environment).getPresetName();
    }

    public EnvironmentRecommendation recommendPresetWithDetails(String environment) {
        if (environment == null || environment.isBlank()) {
            return new EnvironmentRecommendation("simple", 0.40, "No environment given, defaulting to simple preset", environment);
        }
        String normalized = environment.trim().toLowerCase(Locale.ROOT);
        EnvironmentRecommendation exact = EXACT_MATCHES.get(normalized);
        if (exact != null) {
            return new EnvironmentRecommendation(exact.getPresetName(), exact.getConfidence(), exact.getReasoning(), environment);
        }

        if (normalized.contains("ai")) {
            if (matchesAny(AI_PRODUCTION_PATTERNS, normalized)) {
                return new EnvironmentRecommendation("ai-production", 0.80,
                        "Environment name '" + environment + "' matches AI production pattern", environment);
            }
            return new EnvironmentRecommendation("ai-development", 0.75,
                    "Environment name '" + environment + "' contains 'ai', using AI development preset", environment);
        }
        if (matchesAny(STAGING_PATTERNS, normalized)) {
            return new EnvironmentRecommendation("production", 0.70,
                    "Environment name '" + environment + "' matches staging pattern, using production preset", environment);
        }
        if (matchesAny(DEVELOPMENT_PATTERNS, normalized)) {
            return new EnvironmentRecommendation("development", 0.75,
                    "Environment name '" + environment + "' matches development pattern", environment);
        }
        if (matchesAny(PRODUCTION_PATTERNS, normalized)) {
            return new EnvironmentRecommendation("production", 0.75,
                    "Environment name '" + environment + "' matches production pattern", environment);
        }
        return new EnvironmentRecommendation("simple", 0.40,
                "Unknown environment pattern '" + environment + "', defaulting to simple preset", environment);
    }

    /**
     * Validation of every built-in preset, keyed by preset name.
     */
    public Map<String, ValidationResult> validateAll() {
        Map<String, ValidationResult> results = new LinkedHashMap<>();
        presets.forEach((name, preset) -> results.put(name, preset.getConfig().validate()));
        return results;
    }

    private static List<CachePreset> builtInPresets() {
        return List.of(
                CachePreset.builder()
                        .name("disabled")
                        .displayName("Disabled")
                        .description("No remote tier, a small memory-only cache")
                        .environmentContext("testing").environmentContext("minimal")
                        .config(CacheConfig.forStrategy(CacheStrategy.FAST)
                                .defaultTtlSeconds(300)
                                .maxConnections(1)
                                .connectionTimeoutSeconds(1)
                                .memoryCacheSize(10)
                                .compressionThresholdBytes(10_000)
                                .compressionLevel(1)
                                .build())
                        .build(),
                CachePreset.builder()
                        .name("minimal")
                        .displayName("Minimal")
                        .description("Lightweight caching for resource constrained environments")
                        .environmentContext("minimal").environmentContext("embedded").environmentContext("container")
                        .environmentContext("serverless")
                        .config(CacheConfig.forStrategy(CacheStrategy.FAST)
                                .defaultTtlSeconds(900)
                                .maxConnections(2)
                                .connectionTimeoutSeconds(3)
                                .memoryCacheSize(25)
                                .compressionThresholdBytes(5000)
                                .compressionLevel(1)
                                .build())
                        .build(),
                CachePreset.builder()
                        .name("simple")
                        .displayName("Simple")
                        .description("General purpose configuration")
                        .environmentContext("development").environmentContext("testing")
                        .environmentContext("staging").environmentContext("production")
                        .config(CacheConfig.forStrategy(CacheStrategy.BALANCED)
                                .maxConnections(5)
                                .build())
                        .build(),
                CachePreset.builder()
                        .name("development")
                        .displayName("Development")
                        .description("Short TTLs and fast timeouts for quick feedback")
                        .environmentContext("development").environmentContext("local")
                        .config(CacheConfig.forStrategy(CacheStrategy.FAST)
                                .compressionThresholdBytes(2000)
                                .build())
                        .build(),
                CachePreset.builder()
                        .name("production")
                        .displayName("Production")
                        .description("Long TTLs, a large pool and maximum compression")
                        .environmentContext("production").environmentContext("staging")
                        .config(CacheConfig.forStrategy(CacheStrategy.ROBUST).build())
                        .build(),
                CachePreset.builder()
                        .name("ai-development")
                        .displayName("AI Development")
                        .description("AI response caching with development TTLs")
                        .environmentContext("development").environmentContext("ai-development")
                        .config(CacheConfig.forStrategy(CacheStrategy.AI_OPTIMIZED)
                                .defaultTtlSeconds(1800)
                                .maxConnections(5)
                                .connectionTimeoutSeconds(5)
                                .memoryCacheSize(100)
                                .compressionLevel(6)
                                .textHashThreshold(500)
                                .clearOperationTtls()
                                .operationTtl("summarize", 1800)
                                .operationTtl("sentiment", 900)
                                .operationTtl("key_points", 1200)
                                .operationTtl("questions", 1500)
                                .operationTtl("qa", 900)
                                .build())
                        .build(),
                CachePreset.builder()
                        .name("ai-production")
                        .displayName("AI Production")
                        .description("AI response caching tuned for production workloads")
                        .environmentContext("production").environmentContext("ai-production")
                        .config(CacheConfig.forStrategy(CacheStrategy.AI_OPTIMIZED).build())
                        .build());
    }

    private static void exact(String environment, String preset, double confidence, String reasoning) {
        EXACT_MATCHES.put(environment, new EnvironmentRecommendation(preset, confidence, reasoning, environment));
    }

    private static List<Pattern> patterns(String... fragments) {
        List<Pattern> compiled = new ArrayList<>();
        for (String fragment : fragments) {
            compiled.add(Pattern.compile(".*" + fragment + ".*", Pattern.CASE_INSENSITIVE));
        }
        return compiled;
    }

    private static boolean matchesAny(List<Pattern> patterns, String value) {
        return patterns.stream().anyMatch(p -> p.matcher(value).matches());
    }
}
