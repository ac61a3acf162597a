package net.wizeops.tiercache.monitoring;

/**
 * Ordered most to least urgent so that sorting by natural order puts critical items first.
 */
public enum Severity {
    CRITICAL,
    WARNING,
    INFO
}
