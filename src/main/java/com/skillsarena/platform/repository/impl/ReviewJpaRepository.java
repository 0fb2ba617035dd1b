package com.skillsarena.platform.repository.impl;

import com.skillsarena.platform.model.Review;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ReviewJpaRepository extends JpaRepository<Review, String> {
    boolean existsBySkillIdAndReviewerId(String skillId, String reviewerId);
    List<Review> findBySkillId(String skillId);
    List<Review> findByReviewerIdOrderByCreatedAtDesc(String reviewerId, Pageable pageable);
}
