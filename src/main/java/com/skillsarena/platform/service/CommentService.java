package com.skillsarena.platform.service;

import com.skillsarena.platform.config.TransactionalRetryExecutor;
import com.skillsarena.platform.dto.CommentNode;
import com.skillsarena.platform.exception.InvalidRequestException;
import com.skillsarena.platform.exception.NotFoundException;
import com.skillsarena.platform.model.Comment;
import com.skillsarena.platform.model.Identity;
import com.skillsarena.platform.model.Skill;
import com.skillsarena.platform.repository.CommentRepository;
import com.skillsarena.platform.repository.SkillRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class CommentService {

    private static final Logger logger = LoggerFactory.getLogger(CommentService.class);

    private final CommentRepository commentRepository;
    private final SkillRepository skillRepository;
    private final IdentityResolver identityResolver;
    private final TransactionalRetryExecutor retryExecutor;
    private final Clock clock;

    @Autowired
    public CommentService(
            CommentRepository commentRepository,
            SkillRepository skillRepository,
            IdentityResolver identityResolver,
            TransactionalRetryExecutor retryExecutor,
            Clock clock) {
        this.commentRepository = commentRepository;
        this.skillRepository = skillRepository;
        this.identityResolver = identityResolver;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    public Comment addComment(String skillId, String authorToken, String content, String parentCommentId) {
        if (content == null || content.trim().isEmpty()) {
            throw new InvalidRequestException("Comment content cannot be empty");
        }
        Identity author = identityResolver.resolve(authorToken)
            .orElseThrow(NotFoundException::identity);
        boolean isReply = parentCommentId != null && !parentCommentId.trim().isEmpty();

        return retryExecutor.execute("addComment", () -> {
            Skill skill = skillRepository.findByIdForUpdate(skillId)
                .orElseThrow(() -> NotFoundException.skill(skillId));

            String commentId = "comment-" + UUID.randomUUID();
            Comment.CommentBuilder builder = Comment.builder()
                .commentId(commentId)
                .skillId(skillId)
                .authorId(author.getAgentId())
                .content(content.trim())
                .createdAt(clock.instant());

            if (isReply) {
                Comment parent = commentRepository.findByIdForUpdate(parentCommentId)
                    .orElseThrow(() -> NotFoundException.comment(parentCommentId));
                if (!skillId.equals(parent.getSkillId())) {
                    throw new InvalidRequestException("Parent comment " + parentCommentId
                        + " belongs to a different skill");
                }
                builder.parentCommentId(parent.getCommentId())
                    .rootCommentId(parent.getRootCommentId())
                    .depth(parent.getDepth() + 1);
                parent.setRepliesCount(parent.getRepliesCount() + 1);
                commentRepository.save(parent);
            } else {
                builder.rootCommentId(commentId).depth(0);
            }

            Comment comment = commentRepository.save(builder.build());
            skill.setCommentsCount(skill.getCommentsCount() + 1);
            skillRepository.save(skill);

            logger.info("Agent {} commented {} on skill {}{}", author.getAgentId(), commentId, skillId,
                isReply ? " in reply to " + parentCommentId : "");
            return comment;
        });
    }

    /**
     * Visible comments of a skill as a forest, in creation order at every level.
     * Replies whose parent is deleted are attached at the top level.
     */
    public List<CommentNode> getCommentTree(String skillId) {
        if (skillRepository.findById(skillId).isEmpty()) {
            throw NotFoundException.skill(skillId);
        }

        Map<String, CommentNode> nodes = new LinkedHashMap<>();
        for (Comment comment : commentRepository.findVisibleBySkillId(skillId)) {
            nodes.put(comment.getCommentId(), CommentNode.from(comment));
        }

        List<CommentNode> roots = new ArrayList<>();
        for (CommentNode node : nodes.values()) {
            CommentNode parent = node.getParentCommentId() != null ? nodes.get(node.getParentCommentId()) : null;
            if (parent != null) {
                parent.getReplies().add(node);
            } else {
                roots.add(node);
            }
        }
        return roots;
    }
}
