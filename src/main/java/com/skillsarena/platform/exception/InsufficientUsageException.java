package com.skillsarena.platform.exception;

public class InsufficientUsageException extends PolicyViolationException {
    private final long totalUsage;
    private final long requiredUsage;

    public InsufficientUsageException(long totalUsage, long requiredUsage) {
        super("Insufficient usage to review this skill (minimum " + requiredUsage
            + ", current " + totalUsage + ")", "INSUFFICIENT_USAGE");
        this.totalUsage = totalUsage;
        this.requiredUsage = requiredUsage;
    }

    public long getTotalUsage() {
        return totalUsage;
    }

    public long getRequiredUsage() {
        return requiredUsage;
    }
}
