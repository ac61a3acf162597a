package net.wizeops.tiercache.monitoring;

import lombok.Value;

@Value
public class SlowOperation {
    PerformanceMeasurement measurement;
    double categoryAverageMillis;

    public double getTimesSlower() {
        return categoryAverageMillis > 0 ? measurement.getDurationMillis() / categoryAverageMillis : 0;
    }
}
