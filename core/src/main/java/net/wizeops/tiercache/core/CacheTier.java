package net.wizeops.tiercache.core;

import java.util.Locale;

public enum CacheTier {
    MEMORY,
    REMOTE;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
