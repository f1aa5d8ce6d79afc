package org.example.course.model;

public record UserContext(String userId, String tier) {

    public static final String DEFAULT_TIER = "free";

    public UserContext {
        if (tier == null || tier.isBlank()) {
            tier = DEFAULT_TIER;
        }
    }
}
