package com.skillsarena.platform.repository.impl;

import com.skillsarena.platform.model.TargetType;
import com.skillsarena.platform.model.Vote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface VoteJpaRepository extends JpaRepository<Vote, Long> {
    Optional<Vote> findByAgentIdAndTargetTypeAndTargetId(String agentId, TargetType targetType, String targetId);
}
