package net.wizeops.tiercache.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import net.wizeops.tiercache.exceptions.ConfigurationException;

import java.util.Locale;

@Getter
@RequiredArgsConstructor
public enum CacheStrategy {
    /** Short TTLs, small pool, cheap compression. Suited to development. */
    FAST("fast"),
    BALANCED("balanced"),
    /** Long TTLs, large pool, maximum compression. */
    ROBUST("robust"),
    /** Robust settings plus AI features and per-operation TTLs. */
    AI_OPTIMIZED("ai_optimized");

    private final String value;

    public static CacheStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("strategy: value is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (CacheStrategy strategy : values()) {
            if (strategy.value.equals(normalized)) {
                return strategy;
            }
        }
        throw new ConfigurationException("strategy: unknown value '" + value
                + "', expected one of fast, balanced, robust, ai_optimized");
    }
}
