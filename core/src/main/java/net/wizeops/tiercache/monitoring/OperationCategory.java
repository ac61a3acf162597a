package net.wizeops.tiercache.monitoring;

public enum OperationCategory {
    KEY_GENERATION,
    GET,
    SET,
    DELETE,
    COMPRESSION,
    INVALIDATION
}
