package com.skillsarena.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "skills", indexes = {
    @Index(name = "idx_skills_content_hash", columnList = "content_hash", unique = true),
    @Index(name = "idx_skills_name_version", columnList = "name,version"),
    @Index(name = "idx_skills_hot_score", columnList = "visibility,hot_score DESC"),
    @Index(name = "idx_skills_vote_score", columnList = "visibility,vote_score DESC"),
    @Index(name = "idx_skills_created_at", columnList = "visibility,created_at DESC"),
    @Index(name = "idx_skills_rating", columnList = "visibility,rating DESC"),
    @Index(name = "idx_skills_usage_count", columnList = "visibility,usage_count DESC"),
    @Index(name = "idx_skills_community", columnList = "community")
})
@DynamicUpdate
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Skill implements VotableTarget {
    @Id
    @Column(name = "skill_id")
    private String skillId;

    @Column(name = "content_hash", nullable = false, unique = true, length = 64)
    private String contentHash;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "version", nullable = false)
    private String version;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "community")
    private String community;

    @Column(name = "uploader_id", nullable = false)
    private String uploaderId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "skill_uploaders", joinColumns = @JoinColumn(name = "skill_id"))
    @Column(name = "agent_id")
    @Builder.Default
    private Set<String> uploaders = new HashSet<>();

    @Column(name = "uploader_count", nullable = false)
    private int uploaderCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "visibility", nullable = false)
    @Builder.Default
    private Visibility visibility = Visibility.PUBLIC;

    @Column(name = "upvotes", nullable = false)
    private int upvotes;

    @Column(name = "downvotes", nullable = false)
    private int downvotes;

    @Column(name = "vote_score", nullable = false)
    private int voteScore;

    @Column(name = "hot_score", nullable = false)
    private double hotScore;

    @Column(name = "rating", nullable = false)
    private double rating;

    @Column(name = "reviews_count", nullable = false)
    private int reviewsCount;

    @Column(name = "usage_count", nullable = false)
    private long usageCount;

    @Column(name = "total_usage_time", nullable = false)
    private double totalUsageTime;

    @Column(name = "avg_response_time", nullable = false)
    private double avgResponseTime;

    @Column(name = "comments_count", nullable = false)
    private int commentsCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;

    @Column(name = "updated_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant updatedAt;

    @Override
    public TargetType getTargetType() {
        return TargetType.SKILL;
    }

    @Override
    public String getTargetId() {
        return skillId;
    }
}
