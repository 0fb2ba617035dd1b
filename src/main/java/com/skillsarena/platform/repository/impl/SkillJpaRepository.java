package com.skillsarena.platform.repository.impl;

import com.skillsarena.platform.model.Skill;
import com.skillsarena.platform.model.Visibility;
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
public interface SkillJpaRepository extends JpaRepository<Skill, String> {

    /**
     * SELECT ... FOR UPDATE on the skill row. Must run inside a transaction;
     * the lock serializes vote, review and usage writes on the same skill.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Skill s WHERE s.skillId = :skillId")
    Optional<Skill> findByIdForUpdate(@Param("skillId") String skillId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Skill s WHERE s.contentHash = :contentHash")
    Optional<Skill> findByContentHashForUpdate(@Param("contentHash") String contentHash);

    Optional<Skill> findFirstByNameAndVersion(String name, String version);

    List<Skill> findByVisibilityOrderBySkillIdAsc(Visibility visibility, Pageable pageable);

    @Transactional
    @Modifying
    @Query("UPDATE Skill s SET s.hotScore = :hotScore WHERE s.skillId = :skillId")
    int updateHotScore(@Param("skillId") String skillId, @Param("hotScore") double hotScore);
}
