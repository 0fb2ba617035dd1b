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
import com.skillsarena.platform.repository.SkillRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Registers uploaded skill bundles by content hash. Identical content maps to
 * one canonical skill; re-uploads by other agents count as upvotes.
 */
@Service
public class SkillRegistryService {

    private static final Logger logger = LoggerFactory.getLogger(SkillRegistryService.class);

    private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-f]{64}");

    private final SkillRepository skillRepository;
    private final VoteService voteService;
    private final IdentityResolver identityResolver;
    private final TransactionalRetryExecutor retryExecutor;
    private final Clock clock;

    @Autowired
    public SkillRegistryService(
            SkillRepository skillRepository,
            VoteService voteService,
            IdentityResolver identityResolver,
            TransactionalRetryExecutor retryExecutor,
            Clock clock) {
        this.skillRepository = skillRepository;
        this.voteService = voteService;
        this.identityResolver = identityResolver;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    /**
     * Registers a skill bundle. {@code visibility} applies only when the content is new;
     * a duplicate keeps the canonical skill's visibility.
     */
    public SkillRegistration registerSkill(String contentHash, String name, String version, String description,
                                           String community, String visibility, String uploaderToken) {
        String hash = normalizeHash(contentHash);
        validateMetadata(name, version);
        Visibility resolvedVisibility = Visibility.fromValue(visibility);
        Identity uploader = identityResolver.resolve(uploaderToken)
            .orElseThrow(NotFoundException::identity);

        try {
            return retryExecutor.execute("registerSkill",
                () -> register(hash, name.trim(), version.trim(), description, community, resolvedVisibility, uploader));
        } catch (DataIntegrityViolationException e) {
            // A concurrent upload of the same content won the insert; the retry takes the duplicate path
            logger.warn("Concurrent registration of content {}, retrying as duplicate", hash);
            return retryExecutor.execute("registerSkill",
                () -> register(hash, name.trim(), version.trim(), description, community, resolvedVisibility, uploader));
        }
    }

    private SkillRegistration register(String hash, String name, String version, String description,
                                       String community, Visibility visibility, Identity uploader) {
        Optional<Skill> existing = skillRepository.findByContentHashForUpdate(hash);
        if (existing.isPresent()) {
            return registerDuplicate(existing.get(), uploader);
        }

        Optional<Skill> sameVersion = skillRepository.findByNameAndVersion(name, version);
        if (sameVersion.isPresent()) {
            throw new VersionConflictException(name, version, sameVersion.get().getSkillId());
        }

        String skillId = "skill-" + name + "-" + hash.substring(0, 8);
        if (skillRepository.findById(skillId).isPresent()) {
            skillId = "skill-" + name + "-" + hash;
        }

        Instant now = clock.instant();
        Set<String> uploaders = new HashSet<>();
        uploaders.add(uploader.getAgentId());
        Skill skill = Skill.builder()
            .skillId(skillId)
            .contentHash(hash)
            .name(name)
            .version(version)
            .description(description)
            .community(community)
            .uploaderId(uploader.getAgentId())
            .uploaders(uploaders)
            .uploaderCount(1)
            .visibility(visibility)
            .createdAt(now)
            .updatedAt(now)
            .build();
        skillRepository.save(skill);

        logger.info("Registered new {} skill {} ({} v{}) by agent {}",
            visibility.getValue(), skillId, name, version, uploader.getAgentId());
        return SkillRegistration.builder()
            .status(SkillRegistration.Status.NEW)
            .skillId(skillId)
            .uploaderCount(1)
            .message("Skill registered")
            .build();
    }

    private SkillRegistration registerDuplicate(Skill skill, Identity uploader) {
        String agentId = uploader.getAgentId();
        if (skill.getUploaders().add(agentId)) {
            skill.setUploaderCount(skill.getUploaders().size());
            skill.setUpdatedAt(clock.instant());
            skillRepository.save(skill);
        }

        SkillRegistration.SkillRegistrationBuilder result = SkillRegistration.builder()
            .status(SkillRegistration.Status.DUPLICATE)
            .skillId(skill.getSkillId())
            .uploaderCount(skill.getUploaderCount())
            .message("Identical content already registered");

        if (!agentId.equals(skill.getUploaderId())) {
            VoteResult vote = voteService.castVote(TargetType.SKILL, skill.getSkillId(), uploader, VoteAction.UPVOTE);
            result.autoVote(vote.getOutcome());
        }

        logger.info("Duplicate upload of skill {} by agent {} ({} uploaders)",
            skill.getSkillId(), agentId, skill.getUploaderCount());
        return result.build();
    }

    private String normalizeHash(String contentHash) {
        if (contentHash == null) {
            throw new InvalidRequestException("Content hash cannot be null");
        }
        String hash = contentHash.trim().toLowerCase(Locale.ROOT);
        if (!SHA256_HEX.matcher(hash).matches()) {
            throw new InvalidRequestException("Content hash must be a 64-character SHA-256 hex digest");
        }
        return hash;
    }

    private void validateMetadata(String name, String version) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidRequestException("Skill name cannot be null or empty");
        }
        if (version == null || version.trim().isEmpty()) {
            throw new InvalidRequestException("Skill version cannot be null or empty");
        }
    }
}
