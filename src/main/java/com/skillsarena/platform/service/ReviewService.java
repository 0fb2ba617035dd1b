package com.skillsarena.platform.service;

import com.skillsarena.platform.config.TransactionalRetryExecutor;
import com.skillsarena.platform.dto.ReviewResult;
import com.skillsarena.platform.exception.DuplicateReviewException;
import com.skillsarena.platform.exception.InvalidRatingException;
import com.skillsarena.platform.exception.NotFoundException;
import com.skillsarena.platform.model.Identity;
import com.skillsarena.platform.model.Review;
import com.skillsarena.platform.model.Skill;
import com.skillsarena.platform.repository.AgentRepository;
import com.skillsarena.platform.repository.ReviewRepository;
import com.skillsarena.platform.repository.SkillRepository;
import com.skillsarena.platform.repository.UsageRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Service
public class ReviewService {

    private static final Logger logger = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewRepository reviewRepository;
    private final SkillRepository skillRepository;
    private final UsageRecordRepository usageRecordRepository;
    private final AgentRepository agentRepository;
    private final IdentityResolver identityResolver;
    private final TransactionalRetryExecutor retryExecutor;
    private final Clock clock;

    @Autowired
    public ReviewService(
            ReviewRepository reviewRepository,
            SkillRepository skillRepository,
            UsageRecordRepository usageRecordRepository,
            AgentRepository agentRepository,
            IdentityResolver identityResolver,
            TransactionalRetryExecutor retryExecutor,
            Clock clock) {
        this.reviewRepository = reviewRepository;
        this.skillRepository = skillRepository;
        this.usageRecordRepository = usageRecordRepository;
        this.agentRepository = agentRepository;
        this.identityResolver = identityResolver;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    /**
     * Stores a usage-weighted review and recomputes the skill's rating over all
     * of its reviews. The review insert and the rating update share one
     * transaction. Locks are taken reviewer row first, then skill row, so
     * concurrent reviews by one agent are serialized for the burst check.
     */
    public ReviewResult submitReview(String skillId, String reviewerToken, Double rating, String comment) {
        Identity reviewer = identityResolver.resolve(reviewerToken)
            .orElseThrow(NotFoundException::identity);

        return retryExecutor.execute("submitReview",
            () -> submitLocked(skillId, reviewer, rating, comment));
    }

    private ReviewResult submitLocked(String skillId, Identity reviewer, Double rating, String comment) {
        agentRepository.findByIdForUpdate(reviewer.getAgentId())
            .orElseThrow(NotFoundException::identity);
        Skill skill = skillRepository.findByIdForUpdate(skillId)
            .orElseThrow(() -> NotFoundException.skill(skillId));
        validateRating(rating);

        String reviewerId = reviewer.getAgentId();
        long totalUsage = usageRecordRepository.sumUsageCount(skillId, reviewerId);
        double weight = ReviewWeights.computeWeight(totalUsage);

        if (reviewRepository.existsBySkillIdAndReviewerId(skillId, reviewerId)) {
            throw new DuplicateReviewException(skillId);
        }

        Instant now = clock.instant();
        boolean burst = isBurst(reviewerId, now);
        if (burst) {
            logger.warn("Review burst detected for agent {}, damping weight {} by {}",
                reviewerId, weight, ReviewWeights.BURST_DAMPING);
            weight = weight * ReviewWeights.BURST_DAMPING;
        }

        Review review = Review.builder()
            .reviewId("review-" + UUID.randomUUID())
            .skillId(skillId)
            .reviewerId(reviewerId)
            .rating(rating)
            .usageCountAtReview(totalUsage)
            .weight(weight)
            .comment(comment)
            .createdAt(now)
            .build();
        try {
            review = reviewRepository.save(review);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateReviewException(skillId);
        }

        List<Review> reviews = reviewRepository.findBySkillId(skillId);
        skill.setRating(ReviewWeights.weightedRating(reviews));
        skill.setReviewsCount(reviews.size());
        skill.setUpdatedAt(now);
        skillRepository.save(skill);

        logger.info("Agent {} reviewed skill {} with rating {} (weight {}); skill rating now {} over {} reviews",
            reviewerId, skillId, rating, weight, skill.getRating(), skill.getReviewsCount());

        return ReviewResult.builder()
            .reviewId(review.getReviewId())
            .skillId(skillId)
            .weight(weight)
            .burstDamped(burst)
            .skillRating(skill.getRating())
            .reviewsCount(skill.getReviewsCount())
            .build();
    }

    private boolean isBurst(String reviewerId, Instant now) {
        List<Instant> timestamps = new ArrayList<>();
        timestamps.add(now);
        for (Review previous : reviewRepository.findRecentByReviewer(reviewerId, ReviewWeights.BURST_REVIEW_COUNT - 1)) {
            timestamps.add(previous.getCreatedAt());
        }
        return ReviewWeights.isBurst(timestamps);
    }

    private void validateRating(Double rating) {
        if (rating == null || rating.isNaN()) {
            throw new InvalidRatingException("Rating is required");
        }
        if (rating < 0 || rating > 100) {
            throw new InvalidRatingException("Rating must be between 0 and 100, got " + rating);
        }
    }
}
