package net.wizeops.tiercache.security;

/**
 * Urgency of a security recommendation. A fully secured connection only ever receives
 * {@link #OPTIMIZATION} items.
 */
public enum RecommendationCategory {
    CRITICAL,
    IMPORTANT,
    OPTIMIZATION
}
