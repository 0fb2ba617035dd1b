package com.skillsarena.platform.service;

import com.skillsarena.platform.exception.InsufficientUsageException;
import com.skillsarena.platform.model.Review;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Reviewer trust weights and the weighted rating they produce.
 */
public final class ReviewWeights {

    public static final long MIN_USAGE_TO_REVIEW = 5;

    /** Reviews considered by the burst check, including the one being filed. */
    public static final int BURST_REVIEW_COUNT = 3;
    public static final Duration BURST_WINDOW = Duration.ofMinutes(1);
    public static final double BURST_DAMPING = 0.1;

    private ReviewWeights() {
    }

    /**
     * Usage-banded trust weight.
     *
     * @throws InsufficientUsageException when usage is below {@link #MIN_USAGE_TO_REVIEW}
     */
    public static double computeWeight(long totalUsage) {
        if (totalUsage < MIN_USAGE_TO_REVIEW) {
            throw new InsufficientUsageException(totalUsage, MIN_USAGE_TO_REVIEW);
        }
        if (totalUsage < 20) {
            return 1.0;
        }
        if (totalUsage < 50) {
            return 1.5;
        }
        if (totalUsage < 100) {
            return 2.0;
        }
        return 3.0;
    }

    /**
     * True when the newest {@link #BURST_REVIEW_COUNT} timestamps are each less than
     * {@link #BURST_WINDOW} apart from their neighbour.
     *
     * @param newestFirst review timestamps, newest first, including the review being filed
     */
    public static boolean isBurst(List<Instant> newestFirst) {
        if (newestFirst.size() < BURST_REVIEW_COUNT) {
            return false;
        }
        for (int i = 0; i < BURST_REVIEW_COUNT - 1; i++) {
            Duration gap = Duration.between(newestFirst.get(i + 1), newestFirst.get(i)).abs();
            if (gap.compareTo(BURST_WINDOW) >= 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Weight-normalized mean rating, rounded to 2 decimals. Zero when there is no weight.
     */
    public static double weightedRating(List<Review> reviews) {
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (Review review : reviews) {
            weightedSum += review.getRating() * review.getWeight();
            totalWeight += review.getWeight();
        }
        if (totalWeight <= 0.0) {
            return 0.0;
        }
        return BigDecimal.valueOf(weightedSum / totalWeight).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
