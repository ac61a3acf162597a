package net.wizeops.tiercache.management;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.wizeops.tiercache.api.CacheProvider;
import net.wizeops.tiercache.config.CacheConfig;
import net.wizeops.tiercache.exceptions.ValidationException;
import net.wizeops.tiercache.monitoring.CachePerformanceMonitor;
import net.wizeops.tiercache.monitoring.MonitoringAlert;
import net.wizeops.tiercache.monitoring.Severity;
import net.wizeops.tiercache.monitoring.StatsSnapshot;
import net.wizeops.tiercache.security.SecurityManager;
import net.wizeops.tiercache.utils.GlobPattern;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plain-call surface for the host application's management endpoints and lifecycle
 * hooks: health, metrics, pattern invalidation and configuration checks. Binds no port.
 */
@Slf4j
public class CacheManagementService {
    public static final int MAX_PATTERN_LENGTH = 256;
    static final String PROBE_KEY = "health:probe";

    @Getter
    private final CacheProvider cache;
    @Getter
    private final CacheConfig config;
    private final CachePerformanceMonitor monitor;
    private final Clock clock;

    public CacheManagementService(CacheProvider cache, CacheConfig config, CachePerformanceMonitor monitor) {
        this(cache, config, monitor, Clock.systemUTC());
    }

    public CacheManagementService(CacheProvider cache, CacheConfig config, CachePerformanceMonitor monitor, Clock clock) {
        this.cache = cache;
        this.config = config;
        this.monitor = monitor;
        this.clock = clock;
    }

    /**
     * Healthy when the active tiers answer; degraded when the cache still serves but the
     * remote tier is missing or unresponsive, or memory is critical; unhealthy when the
     * cache cannot serve at all.
     */
    public HealthReport getHealth() {
        HealthReport.HealthReportBuilder report = HealthReport.builder()
                .providerName(cache.getProviderName())
                .remoteConfigured(config.hasRemote())
                .remoteActive(cache.isRemoteBacked())
                .timestamp(clock.instant());

        if (cache.isClosed()) {
            return report.status(HealthState.UNHEALTHY)
                    .probeMethod("none")
                    .message("Cache has been closed")
                    .build();
        }

        long start = System.nanoTime();
        String method = "ping";
        boolean probe;
        try {
            probe = cache.ping();
        } catch (UnsupportedOperationException e) {
            method = "roundtrip";
            probe = roundTripProbe();
        } catch (RuntimeException e) {
            log.warn("Health probe failed", e);
            probe = false;
        }
        report.probeMethod(method)
                .probeSucceeded(probe)
                .probeMillis(Duration.ofNanos(System.nanoTime() - start).toMillis());

        HealthState state = HealthState.HEALTHY;
        if (config.hasRemote() && !cache.isRemoteBacked()) {
            state = HealthState.DEGRADED;
            report.message("Remote tier configured but unavailable, serving from memory only");
        }
        if (!probe) {
            if (cache.isRemoteBacked()) {
                state = HealthState.DEGRADED;
                report.message("Remote tier did not answer the probe, memory tier still serving");
            } else {
                state = HealthState.UNHEALTHY;
                report.message("Cache did not answer the probe");
            }
        }
        if (state != HealthState.UNHEALTHY && monitor != null) {
            monitor.recordMemoryUsage(cache.getMemoryUsage());
            Optional<MonitoringAlert> critical = monitor.getMemoryWarnings().stream()
                    .filter(alert -> alert.getSeverity() == Severity.CRITICAL)
                    .findFirst();
            if (critical.isPresent()) {
                state = HealthState.DEGRADED;
                report.message(critical.get().getMessage());
            }
        }
        return report.status(state).build();
    }

    /**
     * Statistics in the monitor's shape, refreshed with the cache's current memory usage.
     */
    public StatsSnapshot getMetrics() {
        if (monitor == null) {
            throw new IllegalStateException("No performance monitor attached");
        }
        monitor.recordMemoryUsage(cache.getMemoryUsage());
        return monitor.getStats();
    }

    public Map<String, Object> getProviderStatistics() {
        return cache.getStatistics().toMap();
    }

    public List<MonitoringAlert> getAlerts() {
        if (monitor == null) {
            return List.of();
        }
        List<MonitoringAlert> alerts = new ArrayList<>(monitor.getMemoryWarnings());
        alerts.addAll(monitor.getInvalidationRecommendations());
        alerts.sort(Comparator.comparing(MonitoringAlert::getSeverity));
        return alerts;
    }

    /**
     * @throws ValidationException naming the {@code pattern} field for blank, match-all or
     *                             overly long patterns
     */
    public int invalidatePattern(String pattern) {
        return invalidatePattern(pattern, null);
    }

    public int invalidatePattern(String pattern, String reason) {
        validatePattern(pattern);
        int removed = cache.invalidatePattern(pattern);
        log.info("Management invalidation of '{}' removed {} keys{}", pattern, removed,
                reason != null ? " (" + reason + ")" : "");
        return removed;
    }

    /**
     * Human-readable configuration issues, errors first; empty when the configuration is clean.
     */
    public List<String> validateConfiguration() {
        return config.validate().getIssues();
    }

    public Map<String, Object> getSecurityStatus() {
        return new SecurityManager(config.getSecurityConfig(), clock).getSecurityStatus();
    }

    static void validatePattern(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new ValidationException("pattern", "must not be blank");
        }
        if (pattern.length() > MAX_PATTERN_LENGTH) {
            throw new ValidationException("pattern", "longer than " + MAX_PATTERN_LENGTH + " characters");
        }
        if (GlobPattern.isEffectivelyMatchAll(pattern.trim())) {
            throw new ValidationException("pattern", "'" + pattern + "' would invalidate every key");
        }
    }

    private boolean roundTripProbe() {
        try {
            cache.set(PROBE_KEY, "ok", Duration.ofSeconds(60));
            boolean found = cache.get(PROBE_KEY).isPresent();
            cache.delete(PROBE_KEY);
            return found;
        } catch (RuntimeException e) {
            log.warn("Round-trip health probe failed", e);
            return false;
        }
    }
}
