package com.skillsarena.platform.repository.impl;

import com.skillsarena.platform.model.Agent;
import com.skillsarena.platform.repository.AgentRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@Primary
public class JpaAgentRepository implements AgentRepository {

    private final AgentJpaRepository jpaRepository;

    @Autowired
    public JpaAgentRepository(AgentJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public Agent save(Agent agent) {
        return jpaRepository.saveAndFlush(agent);
    }

    @Override
    public Optional<Agent> findByDid(String did) {
        return jpaRepository.findByDid(did);
    }

    @Override
    public Optional<Agent> findByUsername(String username) {
        return jpaRepository.findByUsername(username);
    }

    @Override
    public Optional<Agent> findByIdForUpdate(String agentId) {
        return jpaRepository.findByIdForUpdate(agentId);
    }
}
