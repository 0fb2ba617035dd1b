package com.skillsarena.platform.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.skillsarena.platform.model.Skill;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SkillSummary {
    private String skillId;
    private String name;
    private String version;
    private String description;
    private String community;
    private String uploaderId;
    private int uploaderCount;
    private int upvotes;
    private int downvotes;
    private int voteScore;
    private double hotScore;
    private double rating;
    private int reviewsCount;
    private long usageCount;
    private int commentsCount;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;

    public static SkillSummary from(Skill skill) {
        return SkillSummary.builder()
            .skillId(skill.getSkillId())
            .name(skill.getName())
            .version(skill.getVersion())
            .description(skill.getDescription())
            .community(skill.getCommunity())
            .uploaderId(skill.getUploaderId())
            .uploaderCount(skill.getUploaderCount())
            .upvotes(skill.getUpvotes())
            .downvotes(skill.getDownvotes())
            .voteScore(skill.getVoteScore())
            .hotScore(skill.getHotScore())
            .rating(skill.getRating())
            .reviewsCount(skill.getReviewsCount())
            .usageCount(skill.getUsageCount())
            .commentsCount(skill.getCommentsCount())
            .createdAt(skill.getCreatedAt())
            .build();
    }
}
