package com.skillsarena.platform.repository.impl;

import com.skillsarena.platform.model.Agent;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AgentJpaRepository extends JpaRepository<Agent, String> {
    Optional<Agent> findByDid(String did);
    Optional<Agent> findByUsername(String username);

    /**
     * SELECT ... FOR UPDATE on the agent row. Serializes the review submissions
     * of one agent so each sees the previous one when checking for bursts.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Agent a WHERE a.agentId = :agentId")
    Optional<Agent> findByIdForUpdate(@Param("agentId") String agentId);
}
