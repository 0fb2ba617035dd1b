package com.skillsarena.platform.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Time-decayed popularity score:
 * {@code round(log10(max(|up - down|, 1)) + ageHours / 1.8, 4)}.
 * The sign of the vote score is dropped, so the order term measures activity.
 */
public final class HotScoreCalculator {

    public static final double GRAVITY = 1.8;

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private HotScoreCalculator() {
    }

    public static double compute(int upvotes, int downvotes, Instant createdAt, Instant now) {
        int score = upvotes - downvotes;
        double order = Math.log10(Math.max(Math.abs(score), 1));
        double hotScore = order + ageHours(createdAt, now) / GRAVITY;
        return BigDecimal.valueOf(hotScore).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }

    static double ageHours(Instant createdAt, Instant now) {
        if (createdAt == null) {
            return 0.0;
        }
        return Duration.between(createdAt, now).toMillis() / MILLIS_PER_HOUR;
    }
}
