package com.skillsarena.platform.repository;

import com.skillsarena.platform.model.Agent;

import java.util.Optional;

public interface AgentRepository {
    Agent save(Agent agent);
    Optional<Agent> findByDid(String did);

    /** Reads the agent row with a write lock held until the surrounding transaction ends. */
    Optional<Agent> findByIdForUpdate(String agentId);

    Optional<Agent> findByUsername(String username);
}
