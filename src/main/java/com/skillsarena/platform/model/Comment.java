package com.skillsarena.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

/**
 * Flat comment tree: replies point at their parent and carry the id of the top-level comment.
 */
@Entity
@Table(name = "comments", indexes = {
    @Index(name = "idx_comments_skill_created", columnList = "skill_id,created_at"),
    @Index(name = "idx_comments_parent", columnList = "parent_comment_id"),
    @Index(name = "idx_comments_author", columnList = "author_id")
})
@DynamicUpdate
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Comment implements VotableTarget {
    @Id
    @Column(name = "comment_id")
    private String commentId;

    @Column(name = "skill_id", nullable = false)
    private String skillId;

    @Column(name = "parent_comment_id")
    private String parentCommentId;

    @Column(name = "root_comment_id", nullable = false)
    private String rootCommentId;

    @Column(name = "depth", nullable = false)
    private int depth;

    @Column(name = "author_id", nullable = false)
    private String authorId;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "upvotes", nullable = false)
    private int upvotes;

    @Column(name = "downvotes", nullable = false)
    private int downvotes;

    @Column(name = "vote_score", nullable = false)
    private int voteScore;

    @Column(name = "hot_score", nullable = false)
    private double hotScore;

    @Column(name = "replies_count", nullable = false)
    private int repliesCount;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    @Column(name = "created_at", nullable = false, updatable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;

    @Override
    public TargetType getTargetType() {
        return TargetType.COMMENT;
    }

    @Override
    public String getTargetId() {
        return commentId;
    }
}
