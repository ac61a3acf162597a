package net.wizeops.tiercache.providers.ai;

import net.wizeops.tiercache.api.CacheProvider;
import net.wizeops.tiercache.config.CacheConfig;
import net.wizeops.tiercache.config.CacheStrategy;
import net.wizeops.tiercache.exceptions.ValidationException;
import net.wizeops.tiercache.keys.KeyGenerator;
import net.wizeops.tiercache.monitoring.PerformanceMonitor;
import net.wizeops.tiercache.providers.memory.MemoryCacheProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AiResponseCacheTest {

    private CacheConfig config;
    private MemoryCacheProvider memory;
    private AiResponseCache cache;

    @BeforeEach
    void setUp() {
        config = CacheConfig.defaults(CacheStrategy.AI_OPTIMIZED);
        memory = new MemoryCacheProvider(config, null);
        cache = new AiResponseCache(memory, config, PerformanceMonitor.noop());
    }

    @Test
    void shouldCacheAndReturnResponses() {
        // Given
        Map<String, Object> options = Map.of("max_length", 100);

        // When
        cache.cacheResponse("long article", "summarize", options, "short summary");

        // Then
        assertThat(cache.getCachedResponse("long article", "summarize", options)).contains("short summary");
        assertThat(cache.getCachedResponse("long article", "summarize", Map.of())).isEmpty();
        assertThat(cache.getOperationStatistics().get("summarize"))
                .containsEntry("hits", 1L)
                .containsEntry("misses", 1L);
    }

    @Test
    void shouldUseOperationSpecificTtl() {
        // Given
        CacheProvider delegate = mock(CacheProvider.class);
        AiResponseCache mocked = new AiResponseCache(delegate, config, new KeyGenerator());

        // When
        mocked.cacheResponse("text", "sentiment", Map.of(), "positive");
        mocked.cacheResponse("text", "translate", Map.of(), "texte");

        // Then
        verify(delegate).set(startsWith("sentiment:"), eq("positive"), eq(Duration.ofSeconds(7200)));
        verify(delegate).set(startsWith("translate:"), eq("texte"), eq(config.getDefaultTtl()));
    }

    @Test
    void shouldSeparateAnswersByQuestion() {
        // When
        cache.cacheResponse("document", "qa", Map.of(), "Paris", "What is the capital?");

        // Then
        assertThat(cache.getCachedResponse("document", "qa", Map.of(), "What is the capital?")).contains("Paris");
        assertThat(cache.getCachedResponse("document", "qa", Map.of(), "Who wrote it?")).isEmpty();
        assertThat(cache.getCachedResponse("document", "qa", Map.of("question", "What is the capital?"))).contains("Paris");
    }

    @Test
    void shouldInvalidateOneOperationOnly() {
        // Given
        cache.cacheResponse("a", "summarize", Map.of(), "s1");
        cache.cacheResponse("b", "summarize", Map.of(), "s2");
        cache.cacheResponse("a", "sentiment", Map.of(), "positive");

        // When
        int removed = cache.invalidateByOperation("summarize");

        // Then
        assertThat(removed).isEqualTo(2);
        assertThat(cache.getCachedResponse("a", "sentiment", Map.of())).contains("positive");
        assertThatThrownBy(() -> cache.invalidateByOperation(" ")).isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldEscapeGlobCharactersInOperationNames() {
        assertThat(AiResponseCache.escapeGlob("a*b?[c]")).isEqualTo("a\\*b\\?\\[c\\]");
    }

    @Test
    void shouldForwardPlainCacheCalls() {
        // When
        cache.set("plain", 42);

        // Then
        assertThat(memory.get("plain")).contains(42);
        assertThat(cache.getProviderName()).isEqualTo("AiOptimized(Memory)");
        cache.close();
        assertThat(memory.isClosed()).isTrue();
    }
}
