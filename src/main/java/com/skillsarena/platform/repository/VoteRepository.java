package com.skillsarena.platform.repository;

import com.skillsarena.platform.model.TargetType;
import com.skillsarena.platform.model.Vote;

import java.util.Optional;

/**
 * Vote ledger. Only the vote service writes here.
 */
public interface VoteRepository {
    Optional<Vote> findByAgentAndTarget(String agentId, TargetType targetType, String targetId);
    Vote save(Vote vote);
    void delete(Vote vote);
}
