package com.skillsarena.platform.service;

import com.skillsarena.platform.config.TransactionalRetryExecutor;
import com.skillsarena.platform.dto.SkillRegistration;
import com.skillsarena.platform.dto.VoteResult;
import com.skillsarena.platform.exception.InvalidRequestException;
import com.skillsarena.platform.exception.NotFoundException;
import com.skillsarena.platform.exception.VersionConflictException;
import com.skillsarena.platform.model.Identity;
import com.skillsarena.platform.model.Skill;
import com.skillsarena.platform.model.TargetType;
import com.skillsarena.platform.model.Visibility;
import com.skillsarena.platform.model.VoteAction;
import com.skillsarena.platform.model.VoteOutcome;
import com.skillsarena.platform.repository.SkillRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SkillRegistryServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final String HASH = "3f2a9c1b" + "0".repeat(56);

    @Mock
    private SkillRepository skillRepository;

    @Mock
    private VoteService voteService;

    @Mock
    private IdentityResolver identityResolver;

    @Mock
    private PlatformTransactionManager txManager;

    private SkillRegistryService registryService;
    private final Identity alice = new Identity("agent-alice", "did:alice");
    private final Identity bob = new Identity("agent-bob", "did:bob");

    @BeforeEach
    void setUp() {
        registryService = new SkillRegistryService(skillRepository, voteService, identityResolver,
            new TransactionalRetryExecutor(txManager, 3), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Skill existingSkill() {
        Set<String> uploaders = new HashSet<>();
        uploaders.add("agent-alice");
        return Skill.builder()
            .skillId("skill-pdf-tools-3f2a9c1b")
            .contentHash(HASH)
            .name("pdf-tools")
            .version("1.0.0")
            .uploaderId("agent-alice")
            .uploaders(uploaders)
            .uploaderCount(1)
            .createdAt(NOW.minusSeconds(3600))
            .build();
    }

    @Test
    void testRegisterSkill_NewContent() {
        // Arrange
        when(identityResolver.resolve("did:alice")).thenReturn(Optional.of(alice));
        when(skillRepository.findByContentHashForUpdate(HASH)).thenReturn(Optional.empty());
        when(skillRepository.findByNameAndVersion("pdf-tools", "1.0.0")).thenReturn(Optional.empty());
        when(skillRepository.findById("skill-pdf-tools-3f2a9c1b")).thenReturn(Optional.empty());

        // Act
        SkillRegistration registration = registryService.registerSkill(
            HASH.toUpperCase(), "pdf-tools", "1.0.0", "Extract tables from PDFs", "documents", null, "did:alice");

        // Assert
        assertEquals(SkillRegistration.Status.NEW, registration.getStatus());
        assertEquals("skill-pdf-tools-3f2a9c1b", registration.getSkillId());
        assertEquals(1, registration.getUploaderCount());
        verify(skillRepository).save(argThat(skill -> skill.getUploaderCount() == 1
            && skill.getVisibility() == Visibility.PUBLIC
            && skill.getVoteScore() == 0
            && HASH.equals(skill.getContentHash())
            && NOW.equals(skill.getCreatedAt())
            && skill.getUploaders().contains("agent-alice")));
        verifyNoInteractions(voteService);
    }

    @Test
    void testRegisterSkill_PrivateVisibility() {
        // Arrange
        when(identityResolver.resolve("did:alice")).thenReturn(Optional.of(alice));
        when(skillRepository.findByContentHashForUpdate(HASH)).thenReturn(Optional.empty());
        when(skillRepository.findByNameAndVersion("pdf-tools", "1.0.0")).thenReturn(Optional.empty());
        when(skillRepository.findById("skill-pdf-tools-3f2a9c1b")).thenReturn(Optional.empty());

        // Act
        registryService.registerSkill(HASH, "pdf-tools", "1.0.0", null, null, "Private", "did:alice");

        // Assert
        verify(skillRepository).save(argThat(skill -> skill.getVisibility() == Visibility.PRIVATE));
    }

    @Test
    void testRegisterSkill_UnknownVisibility() {
        assertThrows(InvalidRequestException.class,
            () -> registryService.registerSkill(HASH, "pdf-tools", "1.0.0", null, null, "friends", "did:alice"));
        verifyNoInteractions(identityResolver, skillRepository);
    }

    @Test
    void testRegisterSkill_DuplicateByAnotherAgentUpvotes() {
        // Arrange
        Skill existing = existingSkill();
        when(identityResolver.resolve("did:bob")).thenReturn(Optional.of(bob));
        when(skillRepository.findByContentHashForUpdate(HASH)).thenReturn(Optional.of(existing));
        when(voteService.castVote(TargetType.SKILL, existing.getSkillId(), bob, VoteAction.UPVOTE))
            .thenReturn(VoteResult.builder().success(true).outcome(VoteOutcome.UPVOTED).voteScore(1).build());

        // Act
        SkillRegistration registration = registryService.registerSkill(
            HASH, "pdf-tools-copy", "9.9.9", null, null, null, "did:bob");

        // Assert
        assertEquals(SkillRegistration.Status.DUPLICATE, registration.getStatus());
        assertEquals(existing.getSkillId(), registration.getSkillId());
        assertEquals(2, registration.getUploaderCount());
        assertEquals(VoteOutcome.UPVOTED, registration.getAutoVote());
        assertTrue(existing.getUploaders().contains("agent-bob"));
        verify(skillRepository).save(existing);
        verify(skillRepository, never()).findByNameAndVersion(anyString(), anyString());
    }

    @Test
    void testRegisterSkill_RepeatedDuplicateKeepsUploaderCount() {
        // Arrange
        Skill existing = existingSkill();
        existing.getUploaders().add("agent-bob");
        existing.setUploaderCount(2);
        when(identityResolver.resolve("did:bob")).thenReturn(Optional.of(bob));
        when(skillRepository.findByContentHashForUpdate(HASH)).thenReturn(Optional.of(existing));
        when(voteService.castVote(TargetType.SKILL, existing.getSkillId(), bob, VoteAction.UPVOTE))
            .thenReturn(VoteResult.builder().success(true).outcome(VoteOutcome.ALREADY_UPVOTED).build());

        // Act
        SkillRegistration registration = registryService.registerSkill(HASH, "pdf-tools", "1.0.0", null, null, null, "did:bob");

        // Assert
        assertEquals(2, registration.getUploaderCount());
        assertEquals(VoteOutcome.ALREADY_UPVOTED, registration.getAutoVote());
        verify(skillRepository, never()).save(any());
    }

    @Test
    void testRegisterSkill_DuplicateByOriginalUploaderDoesNotVote() {
        // Arrange
        Skill existing = existingSkill();
        when(identityResolver.resolve("did:alice")).thenReturn(Optional.of(alice));
        when(skillRepository.findByContentHashForUpdate(HASH)).thenReturn(Optional.of(existing));

        // Act
        SkillRegistration registration = registryService.registerSkill(HASH, "pdf-tools", "1.0.0", null, null, null, "did:alice");

        // Assert
        assertEquals(SkillRegistration.Status.DUPLICATE, registration.getStatus());
        assertNull(registration.getAutoVote());
        verifyNoInteractions(voteService);
    }

    @Test
    void testRegisterSkill_SameVersionDifferentContentConflicts() {
        // Arrange
        String otherHash = "aaaaaaaa" + "1".repeat(56);
        when(identityResolver.resolve("did:bob")).thenReturn(Optional.of(bob));
        when(skillRepository.findByContentHashForUpdate(otherHash)).thenReturn(Optional.empty());
        when(skillRepository.findByNameAndVersion("pdf-tools", "1.0.0")).thenReturn(Optional.of(existingSkill()));

        // Act & Assert
        VersionConflictException ex = assertThrows(VersionConflictException.class,
            () -> registryService.registerSkill(otherHash, "pdf-tools", "1.0.0", null, null, null, "did:bob"));
        assertEquals("skill-pdf-tools-3f2a9c1b", ex.getConflictingSkillId());
        verify(skillRepository, never()).save(any());
    }

    @Test
    void testRegisterSkill_RejectsMalformedInput() {
        assertThrows(InvalidRequestException.class,
            () -> registryService.registerSkill("not-a-hash", "pdf-tools", "1.0.0", null, null, null, "did:alice"));
        assertThrows(InvalidRequestException.class,
            () -> registryService.registerSkill(HASH, " ", "1.0.0", null, null, null, "did:alice"));
        verifyNoInteractions(identityResolver, skillRepository);
    }

    @Test
    void testRegisterSkill_UnknownUploader() {
        // Arrange
        when(identityResolver.resolve("did:ghost")).thenReturn(Optional.empty());

        // Act & Assert
        assertThrows(NotFoundException.class,
            () -> registryService.registerSkill(HASH, "pdf-tools", "1.0.0", null, null, null, "did:ghost"));
        verifyNoInteractions(skillRepository);
    }
}
