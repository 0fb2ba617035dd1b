package com.skillsarena.platform.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.skillsarena.platform.model.Comment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentNode {
    private String commentId;
    private String parentCommentId;
    private String authorId;
    private String content;
    private int depth;
    private int upvotes;
    private int downvotes;
    private int voteScore;
    private double hotScore;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;

    @Builder.Default
    private List<CommentNode> replies = new ArrayList<>();

    public static CommentNode from(Comment comment) {
        return CommentNode.builder()
            .commentId(comment.getCommentId())
            .parentCommentId(comment.getParentCommentId())
            .authorId(comment.getAuthorId())
            .content(comment.getContent())
            .depth(comment.getDepth())
            .upvotes(comment.getUpvotes())
            .downvotes(comment.getDownvotes())
            .voteScore(comment.getVoteScore())
            .hotScore(comment.getHotScore())
            .createdAt(comment.getCreatedAt())
            .build();
    }
}
