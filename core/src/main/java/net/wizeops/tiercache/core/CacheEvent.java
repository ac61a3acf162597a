package net.wizeops.tiercache.core;

import java.util.Locale;

/**
 * Outcomes a {@link CacheEventListener} can subscribe to.
 */
public enum CacheEvent {
    GET_SUCCESS,
    GET_MISS,
    SET_SUCCESS,
    DELETE_SUCCESS;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
