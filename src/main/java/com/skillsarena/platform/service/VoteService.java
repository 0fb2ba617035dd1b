package com.skillsarena.platform.service;

import com.skillsarena.platform.config.TransactionalRetryExecutor;
import com.skillsarena.platform.dto.VoteResult;
import com.skillsarena.platform.dto.VoteStatus;
import com.skillsarena.platform.model.Comment;
import com.skillsarena.platform.model.Identity;
import com.skillsarena.platform.model.Skill;
import com.skillsarena.platform.model.TargetType;
import com.skillsarena.platform.model.VotableTarget;
import com.skillsarena.platform.model.Vote;
import com.skillsarena.platform.model.VoteAction;
import com.skillsarena.platform.model.VoteState;
import com.skillsarena.platform.model.VoteTransition;
import com.skillsarena.platform.repository.CommentRepository;
import com.skillsarena.platform.repository.SkillRepository;
import com.skillsarena.platform.repository.VoteRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Owns the vote ledger. The ledger row and the target's counters are always
 * written in the same transaction, with the target row locked first.
 */
@Service
public class VoteService {

    private static final Logger logger = LoggerFactory.getLogger(VoteService.class);

    private final VoteRepository voteRepository;
    private final SkillRepository skillRepository;
    private final CommentRepository commentRepository;
    private final IdentityResolver identityResolver;
    private final TransactionalRetryExecutor retryExecutor;
    private final Clock clock;

    @Autowired
    public VoteService(
            VoteRepository voteRepository,
            SkillRepository skillRepository,
            CommentRepository commentRepository,
            IdentityResolver identityResolver,
            TransactionalRetryExecutor retryExecutor,
            Clock clock) {
        this.voteRepository = voteRepository;
        this.skillRepository = skillRepository;
        this.commentRepository = commentRepository;
        this.identityResolver = identityResolver;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    /**
     * Applies a vote action for the caller. Malformed type or action throws;
     * an unknown caller or target returns {@code success=false}.
     */
    public VoteResult vote(String targetType, String targetId, String callerToken, String action) {
        TargetType type = TargetType.fromValue(targetType);
        VoteAction voteAction = VoteAction.fromValue(action);
        if (targetId == null || targetId.trim().isEmpty()) {
            return VoteResult.failure(type.getValue(), targetId, "Target id is required");
        }

        Optional<Identity> identity = identityResolver.resolve(callerToken);
        if (identity.isEmpty()) {
            logger.warn("Vote on {} {} rejected: caller could not be resolved", type.getValue(), targetId);
            return VoteResult.failure(type.getValue(), targetId, "Agent not found");
        }

        return retryExecutor.execute("vote",
            () -> castVote(type, targetId, identity.get(), voteAction));
    }

    /**
     * Reads the caller's current vote on a target and the target's counters.
     * Soft-fails like {@link #vote} for an unknown caller or target.
     */
    public VoteStatus getVoteStatus(String targetType, String targetId, String callerToken) {
        TargetType type = TargetType.fromValue(targetType);
        if (targetId == null || targetId.trim().isEmpty()) {
            return VoteStatus.failure(type.getValue(), targetId, "Target id is required");
        }

        Optional<Identity> identity = identityResolver.resolve(callerToken);
        if (identity.isEmpty()) {
            return VoteStatus.failure(type.getValue(), targetId, "Agent not found");
        }

        Optional<? extends VotableTarget> found = findTarget(type, targetId);
        if (found.isEmpty()) {
            return VoteStatus.failure(type.getValue(), targetId, notFoundMessage(type));
        }
        VotableTarget target = found.get();

        VoteState current = VoteState.of(voteRepository
            .findByAgentAndTarget(identity.get().getAgentId(), type, targetId)
            .map(Vote::getVoteType)
            .orElse(null));
        return VoteStatus.builder()
            .success(true)
            .targetType(type.getValue())
            .targetId(targetId)
            .currentVote(current)
            .upvotes(target.getUpvotes())
            .downvotes(target.getDownvotes())
            .voteScore(target.getVoteScore())
            .build();
    }

    /**
     * Runs one state-machine step. Must be called inside a transaction; used
     * directly by flows that already hold one.
     */
    public VoteResult castVote(TargetType type, String targetId, Identity identity, VoteAction action) {
        Optional<? extends VotableTarget> locked = lockTarget(type, targetId);
        if (locked.isEmpty()) {
            logger.warn("Vote on missing {} {}", type.getValue(), targetId);
            return VoteResult.failure(type.getValue(), targetId, notFoundMessage(type));
        }
        VotableTarget target = locked.get();

        Optional<Vote> existing = voteRepository.findByAgentAndTarget(identity.getAgentId(), type, targetId);
        VoteState from = VoteState.of(existing.map(Vote::getVoteType).orElse(null));
        VoteTransition transition = VoteTransition.of(from, action);

        if (!transition.isNoOp()) {
            Instant now = clock.instant();
            writeLedger(existing, transition, identity, type, targetId, now);
            target.applyVoteDelta(transition.getUpvoteDelta(), transition.getDownvoteDelta());
            saveTarget(target, now);
            logger.info("Agent {} {} {} {}: upvotes={}, downvotes={}, score={}",
                identity.getAgentId(), transition.getOutcome(), type.getValue(), targetId,
                target.getUpvotes(), target.getDownvotes(), target.getVoteScore());
        }

        return VoteResult.builder()
            .success(true)
            .message(transition.getOutcome().getMessage())
            .outcome(transition.getOutcome())
            .targetType(type.getValue())
            .targetId(targetId)
            .currentVote(transition.getTo())
            .upvotes(target.getUpvotes())
            .downvotes(target.getDownvotes())
            .voteScore(target.getVoteScore())
            .build();
    }

    private Optional<? extends VotableTarget> findTarget(TargetType type, String targetId) {
        if (type == TargetType.SKILL) {
            return skillRepository.findById(targetId);
        }
        return commentRepository.findById(targetId);
    }

    private Optional<? extends VotableTarget> lockTarget(TargetType type, String targetId) {
        if (type == TargetType.SKILL) {
            return skillRepository.findByIdForUpdate(targetId);
        }
        return commentRepository.findByIdForUpdate(targetId);
    }

    private void writeLedger(Optional<Vote> existing, VoteTransition transition, Identity identity,
                             TargetType type, String targetId, Instant now) {
        if (transition.getTo() == VoteState.NONE) {
            existing.ifPresent(voteRepository::delete);
            return;
        }

        if (existing.isPresent()) {
            Vote vote = existing.get();
            vote.setVoteType(transition.getTo().toVoteType());
            vote.setUpdatedAt(now);
            voteRepository.save(vote);
            return;
        }

        voteRepository.save(Vote.builder()
            .agentId(identity.getAgentId())
            .targetType(type)
            .targetId(targetId)
            .voteType(transition.getTo().toVoteType())
            .votedAt(now)
            .updatedAt(now)
            .build());
    }

    private static String notFoundMessage(TargetType type) {
        return (type == TargetType.SKILL ? "Skill" : "Comment") + " not found";
    }

    private void saveTarget(VotableTarget target, Instant now) {
        if (target instanceof Skill) {
            Skill skill = (Skill) target;
            skill.setUpdatedAt(now);
            skillRepository.save(skill);
        } else {
            commentRepository.save((Comment) target);
        }
    }
}
