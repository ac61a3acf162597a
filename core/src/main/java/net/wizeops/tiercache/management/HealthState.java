package net.wizeops.tiercache.management;

import java.util.Locale;

public enum HealthState {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
