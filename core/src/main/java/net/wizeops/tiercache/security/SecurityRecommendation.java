package net.wizeops.tiercache.security;

import lombok.Value;

@Value
public class SecurityRecommendation {
    RecommendationCategory category;
    String message;

    @Override
    public String toString() {
        return "[" + category + "] " + message;
    }
}
