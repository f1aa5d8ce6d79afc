package org.example.course.service;

/**
 * Rolling counters enforced per user and tier.
 */
public enum UsageMetric {
    DAILY_STEPS("daily_steps", false),
    DAILY_TOKENS("daily_tokens", false),
    WEEKLY_TOKENS("weekly_tokens", true);

    private final String key;
    private final boolean weekly;

    UsageMetric(String key, boolean weekly) {
        this.key = key;
        this.weekly = weekly;
    }

    public String key() {
        return key;
    }

    public boolean isWeekly() {
        return weekly;
    }
}
