package com.skillsarena.platform.repository;

import com.skillsarena.platform.model.Comment;

import java.util.List;
import java.util.Optional;

public interface CommentRepository {
    Comment save(Comment comment);
    Optional<Comment> findById(String commentId);
    Optional<Comment> findByIdForUpdate(String commentId);
    List<Comment> findVisibleBySkillId(String skillId);
    List<Comment> findVisibleSlice(int page, int size);
    int updateHotScore(String commentId, double hotScore);
}
