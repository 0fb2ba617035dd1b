package com.skillsarena.platform.controller;

import com.skillsarena.platform.dto.RegisterAgentRequest;
import com.skillsarena.platform.model.Agent;
import com.skillsarena.platform.service.AgentIdentityService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v2/agents")
public class AgentController {

    private static final Logger logger = LoggerFactory.getLogger(AgentController.class);

    private final AgentIdentityService agentIdentityService;

    @Autowired
    public AgentController(AgentIdentityService agentIdentityService) {
        this.agentIdentityService = agentIdentityService;
    }

    /**
     * Register an agent.
     * POST /api/v2/agents
     */
    @PostMapping
    public ResponseEntity<Agent> registerAgent(@Valid @RequestBody RegisterAgentRequest request) {
        logger.info("Received POST request to register agent - username: {}", request.getUsername());

        try {
            Agent agent = agentIdentityService.registerAgent(
                request.getDid(), request.getUsername(), request.getDisplayName(), request.getBio());
            logger.info("Agent registered - agentId: {}", agent.getAgentId());
            return ResponseEntity.ok(agent);
        } catch (Exception e) {
            logger.error("Error registering agent - username: {}, error: {}", request.getUsername(), e.getMessage());
            throw e;
        }
    }
}
