package com.skillsarena.platform.repository.impl;

import com.skillsarena.platform.model.Comment;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface CommentJpaRepository extends JpaRepository<Comment, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Comment c WHERE c.commentId = :commentId")
    Optional<Comment> findByIdForUpdate(@Param("commentId") String commentId);

    List<Comment> findBySkillIdAndDeletedFalseOrderByCreatedAtAsc(String skillId);

    List<Comment> findByDeletedFalseOrderByCommentIdAsc(Pageable pageable);

    @Transactional
    @Modifying
    @Query("UPDATE Comment c SET c.hotScore = :hotScore WHERE c.commentId = :commentId")
    int updateHotScore(@Param("commentId") String commentId, @Param("hotScore") double hotScore);
}
