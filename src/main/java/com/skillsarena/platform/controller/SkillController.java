package com.skillsarena.platform.controller;

import com.skillsarena.platform.dto.CommentNode;
import com.skillsarena.platform.dto.CommentRequest;
import com.skillsarena.platform.dto.RegisterSkillRequest;
import com.skillsarena.platform.dto.ReviewRequest;
import com.skillsarena.platform.dto.ReviewResult;
import com.skillsarena.platform.dto.SkillRegistration;
import com.skillsarena.platform.dto.UsageReportRequest;
import com.skillsarena.platform.dto.UsageResult;
import com.skillsarena.platform.model.Comment;
import com.skillsarena.platform.service.CommentService;
import com.skillsarena.platform.service.ReviewService;
import com.skillsarena.platform.service.SkillRegistryService;
import com.skillsarena.platform.service.UsageService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v2/skills")
public class SkillController {

    private static final Logger logger = LoggerFactory.getLogger(SkillController.class);

    static final String AGENT_DID_HEADER = "X-Agent-DID";

    private final SkillRegistryService skillRegistryService;
    private final UsageService usageService;
    private final ReviewService reviewService;
    private final CommentService commentService;

    @Autowired
    public SkillController(
            SkillRegistryService skillRegistryService,
            UsageService usageService,
            ReviewService reviewService,
            CommentService commentService) {
        this.skillRegistryService = skillRegistryService;
        this.usageService = usageService;
        this.reviewService = reviewService;
        this.commentService = commentService;
    }

    /**
     * Register an uploaded skill by content hash.
     * POST /api/v2/skills
     */
    @PostMapping
    public ResponseEntity<SkillRegistration> registerSkill(
            @RequestHeader(value = AGENT_DID_HEADER, required = false) String agentDid,
            @Valid @RequestBody RegisterSkillRequest request) {

        logger.info("Received POST request to register skill - name: {}, version: {}",
            request.getName(), request.getVersion());

        try {
            SkillRegistration registration = skillRegistryService.registerSkill(
                request.getContentHash(), request.getName(), request.getVersion(),
                request.getDescription(), request.getCommunity(), request.getVisibility(), agentDid);
            logger.info("Skill registration finished - skillId: {}, status: {}",
                registration.getSkillId(), registration.getStatus());
            return ResponseEntity.ok(registration);
        } catch (Exception e) {
            logger.error("Error registering skill - name: {}, version: {}, error: {}",
                request.getName(), request.getVersion(), e.getMessage());
            throw e;
        }
    }

    /**
     * Report usage of a skill.
     * POST /api/v2/skills/{skillId}/usage
     */
    @PostMapping("/{skillId}/usage")
    public ResponseEntity<UsageResult> recordUsage(
            @PathVariable String skillId,
            @RequestHeader(value = AGENT_DID_HEADER, required = false) String agentDid,
            @Valid @RequestBody UsageReportRequest request) {

        logger.info("Received POST request to record usage - skillId: {}, usageCount: {}",
            skillId, request.getUsageCount());

        try {
            UsageResult result = usageService.recordUsage(skillId, agentDid, request.getUsageCount(),
                request.getTotalTime(), request.getAvgResponseTime(), request.getSuccessRate());
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            logger.error("Error recording usage - skillId: {}, error: {}", skillId, e.getMessage());
            throw e;
        }
    }

    /**
     * Submit a review.
     * POST /api/v2/skills/{skillId}/review
     */
    @PostMapping("/{skillId}/review")
    public ResponseEntity<ReviewResult> submitReview(
            @PathVariable String skillId,
            @RequestHeader(value = AGENT_DID_HEADER, required = false) String agentDid,
            @Valid @RequestBody ReviewRequest request) {

        logger.info("Received POST request to review skill - skillId: {}, rating: {}", skillId, request.getRating());

        try {
            ReviewResult result = reviewService.submitReview(skillId, agentDid, request.getRating(), request.getComment());
            logger.info("Review stored - skillId: {}, weight: {}, skill rating: {}",
                skillId, result.getWeight(), result.getSkillRating());
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            logger.error("Error submitting review - skillId: {}, error: {}", skillId, e.getMessage());
            throw e;
        }
    }

    /**
     * Comment on a skill or reply to a comment.
     * POST /api/v2/skills/{skillId}/comments
     */
    @PostMapping("/{skillId}/comments")
    public ResponseEntity<Comment> addComment(
            @PathVariable String skillId,
            @RequestHeader(value = AGENT_DID_HEADER, required = false) String agentDid,
            @Valid @RequestBody CommentRequest request) {

        logger.info("Received POST request to comment - skillId: {}, parent: {}",
            skillId, request.getParentCommentId());

        try {
            Comment comment = commentService.addComment(
                skillId, agentDid, request.getContent(), request.getParentCommentId());
            return ResponseEntity.ok(comment);
        } catch (Exception e) {
            logger.error("Error adding comment - skillId: {}, error: {}", skillId, e.getMessage());
            throw e;
        }
    }

    /**
     * Comment tree of a skill.
     * GET /api/v2/skills/{skillId}/comments
     */
    @GetMapping("/{skillId}/comments")
    public ResponseEntity<List<CommentNode>> getComments(@PathVariable String skillId) {
        logger.info("Received GET request for comments - skillId: {}", skillId);
        return ResponseEntity.ok(commentService.getCommentTree(skillId));
    }
}
