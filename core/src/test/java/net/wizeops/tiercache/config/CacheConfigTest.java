package net.wizeops.tiercache.config;

import net.wizeops.tiercache.exceptions.ConfigurationException;
import net.wizeops.tiercache.security.SecurityConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CacheConfigTest {

    @ParameterizedTest
    @EnumSource(CacheStrategy.class)
    void shouldProduceValidDefaultsForEveryStrategy(CacheStrategy strategy) {
        // When
        ValidationResult result = CacheConfig.defaults(strategy).validate();

        // Then
        assertThat(result.isValid()).as(result.getIssues().toString()).isTrue();
    }

    @Test
    void shouldSeedAiOptimizedOperationTtls() {
        // When
        CacheConfig config = CacheConfig.defaults(CacheStrategy.AI_OPTIMIZED);

        // Then
        assertThat(config.isEnableAiFeatures()).isTrue();
        assertThat(config.getOperationTtls()).containsEntry("summarize", 14_400).containsEntry("qa", 7200);
        assertThat(config.ttlForOperation("sentiment")).isEqualTo(Duration.ofSeconds(7200));
        assertThat(config.ttlForOperation("translate")).isEqualTo(config.getDefaultTtl());
    }

    @Test
    void shouldReportEveryOutOfRangeField() {
        // Given
        CacheConfig config = CacheConfig.builder()
                .defaultTtlSeconds(10)
                .maxConnections(500)
                .compressionLevel(0)
                .build();

        // When
        ValidationResult result = config.validate();

        // Then
        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).containsExactly(
                "defaultTtlSeconds: 10 is outside the allowed range 60-86400",
                "maxConnections: 500 is outside the allowed range 1-100",
                "compressionLevel: 0 is outside the allowed range 1-9");
    }

    @Test
    void shouldRequireAiFeaturesForAiOptimizedStrategy() {
        // Given
        CacheConfig config = CacheConfig.forStrategy(CacheStrategy.AI_OPTIMIZED).enableAiFeatures(false).build();

        // When / Then
        assertThat(config.validate().getErrors()).anyMatch(e -> e.startsWith("enableAiFeatures"));
    }

    @Test
    void shouldWarnWhenAiFeaturesHaveNoOperationTtls() {
        // Given
        CacheConfig config = CacheConfig.builder().enableAiFeatures(true).build();

        // When
        ValidationResult result = config.validate();

        // Then
        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).anyMatch(w -> w.startsWith("operationTtls"));
        assertThat(result.getIssues()).allMatch(i -> i.startsWith("WARNING: ") || i.startsWith("ERROR: "));
    }

    @Test
    void shouldValidateRemoteUrl() {
        assertThat(CacheConfig.builder().remoteUrl("http://localhost").build().validate().getErrors())
                .containsExactly("remoteUrl: must start with redis:// or rediss://");
        assertThat(CacheConfig.builder().remoteUrl("redis://cache.internal:6379/0").build().validate().isValid())
                .isTrue();
        assertThat(CacheConfig.builder().remoteUrl("rediss://cache.internal:6380").build().validate().getWarnings())
                .anyMatch(w -> w.startsWith("remoteUrl: rediss://"));
    }

    @Test
    void shouldMergeSecurityValidation() {
        // Given
        CacheConfig config = CacheConfig.builder()
                .securityConfig(SecurityConfig.builder().aclUsername("app").build())
                .build();

        // When / Then
        assertThat(config.validate().getErrors()).contains("securityConfig.aclPassword: required when aclUsername is set");
    }

    @Test
    void shouldThrowWithAllErrorsOnValidateOrThrow() {
        // Given
        CacheConfig config = CacheConfig.builder().memoryCacheSize(0).textHashThreshold(1).build();

        // When / Then
        assertThatThrownBy(config::validateOrThrow)
                .isInstanceOf(ConfigurationException.class)
                .satisfies(e -> assertThat(((ConfigurationException) e).getIssues()).hasSize(2));
    }

    @Test
    void shouldRoundTripThroughMapForEveryPreset() {
        // Given
        CachePresetManager presets = new CachePresetManager();

        for (CachePreset preset : presets.getAllPresets().values()) {
            // When
            CacheConfig restored = CacheConfig.fromMap(preset.getConfig().toMap());

            // Then
            assertThat(restored).as(preset.getName()).isEqualTo(preset.getConfig());
        }
    }

    @Test
    void shouldRoundTripThroughJson() {
        // Given
        CacheConfig config = CacheConfig.forStrategy(CacheStrategy.ROBUST)
                .remoteUrl("redis://cache:6379")
                .failOnConnectionError(true)
                .operationTtl("summarize", 600)
                .securityConfig(SecurityConfig.builder().authPassword("a-long-enough-password").build())
                .build();

        // When
        CacheConfig restored = CacheConfig.fromJson(config.toJson());

        // Then
        assertThat(restored).isEqualTo(config);
    }

    @Test
    void shouldRejectUnknownAndMalformedFields() {
        // Given
        Map<String, Object> map = new HashMap<>();
        map.put("defaultTtl", 100);
        map.put("maxConnections", "many");
        map.put("operationTtls", "summarize=10");

        // When / Then
        assertThatThrownBy(() -> CacheConfig.fromMap(map))
                .isInstanceOf(ConfigurationException.class)
                .satisfies(e -> assertThat(((ConfigurationException) e).getIssues())
                        .anyMatch(i -> i.startsWith("defaultTtl: unknown"))
                        .anyMatch(i -> i.startsWith("maxConnections"))
                        .anyMatch(i -> i.startsWith("operationTtls")));
    }

    @Test
    void shouldReseedDefaultsWhenStrategyIsOverridden() {
        // Given
        CacheConfig base = CacheConfig.forStrategy(CacheStrategy.FAST).remoteUrl("redis://cache:6379").build();

        // When
        CacheConfig overridden = CacheConfig.applyOverrides(base, Map.of("strategy", "robust", "memoryCacheSize", 42));

        // Then
        assertThat(overridden.getStrategy()).isEqualTo(CacheStrategy.ROBUST);
        assertThat(overridden.getDefaultTtlSeconds()).isEqualTo(7200);
        assertThat(overridden.getMemoryCacheSize()).isEqualTo(42);
        assertThat(overridden.getRemoteUrl()).isEqualTo("redis://cache:6379");
    }

    @Test
    void shouldAcceptNumericStringsForIntegerFields() {
        assertThat(CacheConfig.fromMap(Map.of("defaultTtlSeconds", "120")).getDefaultTtlSeconds()).isEqualTo(120);
    }

    @Test
    void shouldParseStrategyValuesLeniently() {
        assertThat(CacheStrategy.fromValue("AI-Optimized")).isEqualTo(CacheStrategy.AI_OPTIMIZED);
        assertThatThrownBy(() -> CacheStrategy.fromValue("turbo")).isInstanceOf(ConfigurationException.class);
    }
}
