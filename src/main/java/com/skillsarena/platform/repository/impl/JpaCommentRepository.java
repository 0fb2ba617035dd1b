package com.skillsarena.platform.repository.impl;

import com.skillsarena.platform.model.Comment;
import com.skillsarena.platform.repository.CommentRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@Primary
public class JpaCommentRepository implements CommentRepository {

    private final CommentJpaRepository jpaRepository;

    @Autowired
    public JpaCommentRepository(CommentJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public Comment save(Comment comment) {
        return jpaRepository.save(comment);
    }

    @Override
    public Optional<Comment> findById(String commentId) {
        return jpaRepository.findById(commentId);
    }

    @Override
    public Optional<Comment> findByIdForUpdate(String commentId) {
        return jpaRepository.findByIdForUpdate(commentId);
    }

    @Override
    public List<Comment> findVisibleBySkillId(String skillId) {
        return jpaRepository.findBySkillIdAndDeletedFalseOrderByCreatedAtAsc(skillId);
    }

    @Override
    public List<Comment> findVisibleSlice(int page, int size) {
        return jpaRepository.findByDeletedFalseOrderByCommentIdAsc(PageRequest.of(page, size));
    }

    @Override
    public int updateHotScore(String commentId, double hotScore) {
        return jpaRepository.updateHotScore(commentId, hotScore);
    }
}
