package net.wizeops.tiercache.security;

public enum SecurityLevel {
    HIGH,
    MEDIUM,
    LOW
}
