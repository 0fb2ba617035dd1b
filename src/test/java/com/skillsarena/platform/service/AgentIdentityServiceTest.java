package com.skillsarena.platform.service;

import com.skillsarena.platform.exception.InvalidRequestException;
import com.skillsarena.platform.model.Agent;
import com.skillsarena.platform.model.Identity;
import com.skillsarena.platform.repository.AgentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentIdentityServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    private AgentRepository agentRepository;

    private AgentIdentityService identityService;

    @BeforeEach
    void setUp() {
        identityService = new AgentIdentityService(agentRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testResolve_KnownDid() {
        // Arrange
        Agent agent = Agent.builder().agentId("agent-1").did("did:arena:abc").username("alice").build();
        when(agentRepository.findByDid("did:arena:abc")).thenReturn(Optional.of(agent));

        // Act
        Optional<Identity> identity = identityService.resolve(" did:arena:abc ");

        // Assert
        assertTrue(identity.isPresent());
        assertEquals("agent-1", identity.get().getAgentId());
    }

    @Test
    void testResolve_UnknownOrBlankToken() {
        when(agentRepository.findByDid("did:arena:nobody")).thenReturn(Optional.empty());

        assertFalse(identityService.resolve("did:arena:nobody").isPresent());
        assertFalse(identityService.resolve(null).isPresent());
        assertFalse(identityService.resolve("  ").isPresent());
    }

    @Test
    void testRegisterAgent_New() {
        // Arrange
        when(agentRepository.findByDid("did:arena:abc")).thenReturn(Optional.empty());
        when(agentRepository.findByUsername("alice")).thenReturn(Optional.empty());
        when(agentRepository.save(any(Agent.class))).thenAnswer(inv -> inv.getArgument(0));

        // Act
        Agent agent = identityService.registerAgent("did:arena:abc", "alice", null, "Builds PDF tools");

        // Assert
        assertTrue(agent.getAgentId().startsWith("agent-"));
        assertEquals("alice", agent.getDisplayName());
        assertEquals(NOW, agent.getCreatedAt());
    }

    @Test
    void testRegisterAgent_SameDidIsIdempotent() {
        // Arrange
        Agent existing = Agent.builder().agentId("agent-1").did("did:arena:abc").username("alice").build();
        when(agentRepository.findByDid("did:arena:abc")).thenReturn(Optional.of(existing));

        // Act
        Agent agent = identityService.registerAgent("did:arena:abc", "someone-else", null, null);

        // Assert
        assertSame(existing, agent);
        verify(agentRepository, never()).save(any());
    }

    @Test
    void testRegisterAgent_UsernameTaken() {
        // Arrange
        when(agentRepository.findByDid("did:arena:new")).thenReturn(Optional.empty());
        when(agentRepository.findByUsername("alice"))
            .thenReturn(Optional.of(Agent.builder().agentId("agent-1").username("alice").build()));

        // Act & Assert
        assertThrows(InvalidRequestException.class,
            () -> identityService.registerAgent("did:arena:new", "alice", null, null));
        verify(agentRepository, never()).save(any());
    }

    @Test
    void testRegisterAgent_RequiresDidAndUsername() {
        assertThrows(InvalidRequestException.class, () -> identityService.registerAgent("", "alice", null, null));
        assertThrows(InvalidRequestException.class, () -> identityService.registerAgent("did:x", null, null, null));
        verifyNoInteractions(agentRepository);
    }
}
