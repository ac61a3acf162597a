package net.wizeops.tiercache.exceptions;

import lombok.Getter;

import java.util.List;

/**
 * Raised when a cache configuration is invalid. Never recovered silently: the
 * caller is expected to refuse to start.
 */
@Getter
public class ConfigurationException extends CacheException {
    private final List<String> issues;

    public ConfigurationException(String message) {
        this(message, List.of(message));
    }

    public ConfigurationException(String message, List<String> issues) {
        super(message);
        this.issues = List.copyOf(issues);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.issues = List.of(message);
    }
}
