package com.skillsarena.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Immutable once stored; one per (reviewer, skill).
 */
@Entity
@Table(name = "reviews",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_reviews_skill_reviewer", columnNames = {"skill_id", "reviewer_id"}),
    indexes = {
        @Index(name = "idx_reviews_skill", columnList = "skill_id"),
        @Index(name = "idx_reviews_reviewer_created", columnList = "reviewer_id,created_at DESC")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Review {
    @Id
    @Column(name = "review_id")
    private String reviewId;

    @Column(name = "skill_id", nullable = false, updatable = false)
    private String skillId;

    @Column(name = "reviewer_id", nullable = false, updatable = false)
    private String reviewerId;

    @Column(name = "rating", nullable = false, updatable = false)
    private double rating;

    @Column(name = "usage_count_at_review", nullable = false, updatable = false)
    private long usageCountAtReview;

    @Column(name = "weight", nullable = false, updatable = false)
    private double weight;

    @Column(name = "comment", columnDefinition = "TEXT", updatable = false)
    private String comment;

    @Column(name = "created_at", nullable = false, updatable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;
}
