package com.skillsarena.platform.repository;

import com.skillsarena.platform.model.Review;

import java.util.List;

public interface ReviewRepository {
    Review save(Review review);
    boolean existsBySkillIdAndReviewerId(String skillId, String reviewerId);
    List<Review> findBySkillId(String skillId);

    /** Most recent reviews by the reviewer across all skills, newest first. */
    List<Review> findRecentByReviewer(String reviewerId, int limit);
}
