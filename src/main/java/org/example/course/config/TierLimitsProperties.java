package org.example.course.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Numeric limits per subscription tier, bound from {@code course.tiers.*}.
 * Unknown tiers fall back to {@link #getDefaultTier()}.
 */
@Component
@ConfigurationProperties(prefix = "course.tiers")
public class TierLimitsProperties {

    private String defaultTier = "free";
    private Map<String, Limits> limits = new LinkedHashMap<>();

    public TierLimitsProperties() {
        limits.put("free", new Limits(2, 100, 100_000L, 1_000_000L));
        limits.put("pro", new Limits(5, 1000, 500_000L, 5_000_000L));
    }

    public Limits resolve(String tier) {
        String key = tier == null ? defaultTier : tier.trim().toLowerCase(Locale.ROOT);
        Limits resolved = limits.get(key);
        if (resolved != null) {
            return resolved;
        }
        Limits fallback = limits.get(defaultTier);
        return fallback != null ? fallback : new Limits();
    }

    public String normalizeTier(String tier) {
        String key = tier == null ? "" : tier.trim().toLowerCase(Locale.ROOT);
        return limits.containsKey(key) ? key : defaultTier;
    }

    public String getDefaultTier() {
        return defaultTier;
    }

    public void setDefaultTier(String defaultTier) {
        this.defaultTier = defaultTier == null || defaultTier.isBlank() ? "free" : defaultTier;
    }

    public Map<String, Limits> getLimits() {
        return limits;
    }

    public void setLimits(Map<String, Limits> limits) {
        this.limits = limits == null ? new LinkedHashMap<>() : limits;
    }

    public static class Limits {
        private int maxActiveCourses = 2;
        private int dailySteps = 100;
        private long dailyTokens = 100_000L;
        private long weeklyTokens = 1_000_000L;

        public Limits() {
        }

        public Limits(int maxActiveCourses, int dailySteps, long dailyTokens, long weeklyTokens) {
            this.maxActiveCourses = maxActiveCourses;
            this.dailySteps = dailySteps;
            this.dailyTokens = dailyTokens;
            this.weeklyTokens = weeklyTokens;
        }

        public int getMaxActiveCourses() {
            return maxActiveCourses;
        }

        public void setMaxActiveCourses(int maxActiveCourses) {
            this.maxActiveCourses = maxActiveCourses;
        }

        public int getDailySteps() {
            return dailySteps;
        }

        public void setDailySteps(int dailySteps) {
            this.dailySteps = dailySteps;
        }

        public long getDailyTokens() {
            return dailyTokens;
        }

        public void setDailyTokens(long dailyTokens) {
            this.dailyTokens = dailyTokens;
        }

        public long getWeeklyTokens() {
            return weeklyTokens;
        }

        public void setWeeklyTokens(long weeklyTokens) {
            this.weeklyTokens = weeklyTokens;
        }
    }
}
