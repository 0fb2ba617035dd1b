package com.skillsarena.platform.service;

import com.skillsarena.platform.exception.InvalidRequestException;
import com.skillsarena.platform.model.Agent;
import com.skillsarena.platform.model.Identity;
import com.skillsarena.platform.repository.AgentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Service
public class AgentIdentityService implements IdentityResolver {

    private static final Logger logger = LoggerFactory.getLogger(AgentIdentityService.class);

    private final AgentRepository agentRepository;
    private final Clock clock;

    @Autowired
    public AgentIdentityService(AgentRepository agentRepository, Clock clock) {
        this.agentRepository = agentRepository;
        this.clock = clock;
    }

    @Override
    public Optional<Identity> resolve(String token) {
        if (token == null || token.trim().isEmpty()) {
            return Optional.empty();
        }
        return agentRepository.findByDid(token.trim())
            .map(agent -> new Identity(agent.getAgentId(), agent.getDid()));
    }

    /**
     * Registers an agent under its DID. Registering a DID twice returns the
     * existing agent unchanged.
     */
    public Agent registerAgent(String did, String username, String displayName, String bio) {
        validateRegistration(did, username);
        String normalizedDid = did.trim();
        String normalizedUsername = username.trim();

        Optional<Agent> existing = agentRepository.findByDid(normalizedDid);
        if (existing.isPresent()) {
            logger.info("Agent with DID {} already registered as {}", normalizedDid, existing.get().getAgentId());
            return existing.get();
        }

        if (agentRepository.findByUsername(normalizedUsername).isPresent()) {
            throw new InvalidRequestException("Username already taken: " + normalizedUsername);
        }

        Instant now = clock.instant();
        Agent agent = Agent.builder()
            .agentId("agent-" + UUID.randomUUID())
            .did(normalizedDid)
            .username(normalizedUsername)
            .displayName(displayName != null ? displayName : normalizedUsername)
            .bio(bio)
            .createdAt(now)
            .lastActiveAt(now)
            .build();

        try {
            agent = agentRepository.save(agent);
        } catch (DataIntegrityViolationException e) {
            // Lost a race with a concurrent registration of the same DID or username
            logger.warn("Concurrent registration for DID {}: {}", normalizedDid, e.getMessage());
            return agentRepository.findByDid(normalizedDid)
                .orElseThrow(() -> new InvalidRequestException("Username already taken: " + normalizedUsername));
        }

        logger.info("Registered agent {} with username {}", agent.getAgentId(), normalizedUsername);
        return agent;
    }

    private void validateRegistration(String did, String username) {
        if (did == null || did.trim().isEmpty()) {
            throw new InvalidRequestException("DID cannot be null or empty");
        }
        if (username == null || username.trim().isEmpty()) {
            throw new InvalidRequestException("Username cannot be null or empty");
        }
    }
}
