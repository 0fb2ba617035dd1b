package com.skillsarena.platform.repository.impl;

import com.skillsarena.platform.model.TargetType;
import com.skillsarena.platform.model.Vote;
import com.skillsarena.platform.repository.VoteRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@Primary
public class JpaVoteRepository implements VoteRepository {

    private final VoteJpaRepository jpaRepository;

    @Autowired
    public JpaVoteRepository(VoteJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public Optional<Vote> findByAgentAndTarget(String agentId, TargetType targetType, String targetId) {
        return jpaRepository.findByAgentIdAndTargetTypeAndTargetId(agentId, targetType, targetId);
    }

    @Override
    public Vote save(Vote vote) {
        return jpaRepository.save(vote);
    }

    @Override
    public void delete(Vote vote) {
        jpaRepository.delete(vote);
    }
}
