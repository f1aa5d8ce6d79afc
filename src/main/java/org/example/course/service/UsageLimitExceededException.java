package org.example.course.service;

/**
 * A tier limit denied the request. Carries the current usage so callers can offer an upgrade.
 */
public class UsageLimitExceededException extends RuntimeException {

    public static final String DAILY_STEP_LIMIT_REACHED = "DAILY_STEP_LIMIT_REACHED";
    public static final String COURSE_LIMIT_REACHED = "COURSE_LIMIT_REACHED";
    public static final String TOKEN_LIMIT_REACHED = "TOKEN_LIMIT_REACHED";

    private final String code;
    private final String tier;
    private final long used;
    private final long limit;
    private final boolean canUpgrade;

    public UsageLimitExceededException(String code, String message, String tier, long used, long limit,
                                       boolean canUpgrade) {
        super(message);
        this.code = code;
        this.tier = tier;
        this.used = used;
        this.limit = limit;
        this.canUpgrade = canUpgrade;
    }

    public String getCode() {
        return code;
    }

    public String getTier() {
        return tier;
    }

    public long getUsed() {
        return used;
    }

    public long getLimit() {
        return limit;
    }

    public boolean isCanUpgrade() {
        return canUpgrade;
    }
}
