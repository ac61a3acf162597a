package net.wizeops.tiercache.monitoring;

import java.time.Duration;

/**
 * Sink for timing and outcome of cache-affecting operations. Components take one at
 * construction time and fall back to {@link #noop()} when none is supplied.
 */
public interface PerformanceMonitor {

    void record(OperationCategory category, Duration duration, MeasurementContext context);

    default void record(OperationCategory category, Duration duration) {
        record(category, duration, MeasurementContext.EMPTY);
    }

    default void recordMemoryUsage(MemoryUsageSample sample) {
    }

    static PerformanceMonitor noop() {
        return NoOpPerformanceMonitor.INSTANCE;
    }

    static PerformanceMonitor orNoop(PerformanceMonitor monitor) {
        return monitor != null ? monitor : NoOpPerformanceMonitor.INSTANCE;
    }
}
