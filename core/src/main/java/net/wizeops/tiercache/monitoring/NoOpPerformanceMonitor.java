package net.wizeops.tiercache.monitoring;

import java.time.Duration;

final class NoOpPerformanceMonitor implements PerformanceMonitor {
    static final NoOpPerformanceMonitor INSTANCE = new NoOpPerformanceMonitor();

    private NoOpPerformanceMonitor() {
    }

    @Override
    public void record(OperationCategory category, Duration duration, MeasurementContext context) {
    }
}
