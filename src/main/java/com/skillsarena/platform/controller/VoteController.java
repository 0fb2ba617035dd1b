package com.skillsarena.platform.controller;

import com.skillsarena.platform.dto.VoteRequest;
import com.skillsarena.platform.dto.VoteResult;
import com.skillsarena.platform.dto.VoteStatus;
import com.skillsarena.platform.service.VoteService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v2/votes")
public class VoteController {

    private static final Logger logger = LoggerFactory.getLogger(VoteController.class);

    private final VoteService voteService;

    @Autowired
    public VoteController(VoteService voteService) {
        this.voteService = voteService;
    }

    /**
     * Upvote, downvote or cancel a vote on a skill or comment.
     * POST /api/v2/votes
     */
    @PostMapping
    public ResponseEntity<VoteResult> vote(
            @RequestHeader(value = SkillController.AGENT_DID_HEADER, required = false) String agentDid,
            @Valid @RequestBody VoteRequest request) {

        logger.info("Received POST request to vote - {} {} action: {}",
            request.getTargetType(), request.getTargetId(), request.getAction());

        try {
            VoteResult result = voteService.vote(
                request.getTargetType(), request.getTargetId(), agentDid, request.getAction());
            logger.info("Vote processed - {} {}, success: {}, score: {}",
                request.getTargetType(), request.getTargetId(), result.isSuccess(), result.getVoteScore());
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            logger.error("Error processing vote - {} {}, error: {}",
                request.getTargetType(), request.getTargetId(), e.getMessage());
            throw e;
        }
    }

    /**
     * The caller's current vote on a skill or comment.
     * GET /api/v2/votes/{targetType}/{targetId}
     */
    @GetMapping("/{targetType}/{targetId}")
    public ResponseEntity<VoteStatus> getVoteStatus(
            @RequestHeader(value = SkillController.AGENT_DID_HEADER, required = false) String agentDid,
            @PathVariable String targetType,
            @PathVariable String targetId) {

        logger.info("Received GET request for vote status - {} {}", targetType, targetId);

        try {
            VoteStatus status = voteService.getVoteStatus(targetType, targetId, agentDid);
            logger.info("Vote status - {} {}, success: {}, current: {}",
                targetType, targetId, status.isSuccess(), status.getCurrentVote());
            return ResponseEntity.ok(status);
        } catch (Exception e) {
            logger.error("Error reading vote status - {} {}, error: {}", targetType, targetId, e.getMessage());
            throw e;
        }
    }
}
