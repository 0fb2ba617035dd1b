package com.skillsarena.platform.repository.impl;

import com.skillsarena.platform.model.Review;
import com.skillsarena.platform.repository.ReviewRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@Primary
public class JpaReviewRepository implements ReviewRepository {

    private final ReviewJpaRepository jpaRepository;

    @Autowired
    public JpaReviewRepository(ReviewJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public Review save(Review review) {
        // saveAndFlush so a unique-key race surfaces inside the caller's try block
        return jpaRepository.saveAndFlush(review);
    }

    @Override
    public boolean existsBySkillIdAndReviewerId(String skillId, String reviewerId) {
        return jpaRepository.existsBySkillIdAndReviewerId(skillId, reviewerId);
    }

    @Override
    public List<Review> findBySkillId(String skillId) {
        return jpaRepository.findBySkillId(skillId);
    }

    @Override
    public List<Review> findRecentByReviewer(String reviewerId, int limit) {
        return jpaRepository.findByReviewerIdOrderByCreatedAtDesc(reviewerId, PageRequest.of(0, limit));
    }
}
