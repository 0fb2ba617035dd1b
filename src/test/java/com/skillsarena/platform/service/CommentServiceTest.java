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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommentServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    private CommentRepository commentRepository;

    @Mock
    private SkillRepository skillRepository;

    @Mock
    private IdentityResolver identityResolver;

    @Mock
    private PlatformTransactionManager txManager;

    private CommentService commentService;
    private Skill skill;

    @BeforeEach
    void setUp() {
        commentService = new CommentService(commentRepository, skillRepository, identityResolver,
            new TransactionalRetryExecutor(txManager, 3), Clock.fixed(NOW, ZoneOffset.UTC));
        skill = Skill.builder().skillId("skill-1").commentsCount(2).createdAt(NOW).build();
    }

    private static Comment comment(String id, String parentId, String rootId, int depth) {
        return Comment.builder()
            .commentId(id)
            .skillId("skill-1")
            .parentCommentId(parentId)
            .rootCommentId(rootId)
            .depth(depth)
            .authorId("agent-alice")
            .content("text of " + id)
            .createdAt(NOW)
            .build();
    }

    @Test
    void testAddComment_TopLevel() {
        // Arrange
        when(identityResolver.resolve("did:alice")).thenReturn(Optional.of(new Identity("agent-alice", "did:alice")));
        when(skillRepository.findByIdForUpdate("skill-1")).thenReturn(Optional.of(skill));
        when(commentRepository.save(any(Comment.class))).thenAnswer(inv -> inv.getArgument(0));

        // Act
        Comment comment = commentService.addComment("skill-1", "did:alice", "  Works well  ", null);

        // Assert
        assertEquals("Works well", comment.getContent());
        assertEquals(0, comment.getDepth());
        assertEquals(comment.getCommentId(), comment.getRootCommentId());
        assertNull(comment.getParentCommentId());
        assertEquals(NOW, comment.getCreatedAt());
        assertEquals(3, skill.getCommentsCount());
        verify(skillRepository).save(skill);
    }

    @Test
    void testAddComment_ReplyInheritsRootAndIncrementsParent() {
        // Arrange
        Comment parent = comment("comment-1", null, "comment-1", 0);
        when(identityResolver.resolve("did:bob")).thenReturn(Optional.of(new Identity("agent-bob", "did:bob")));
        when(skillRepository.findByIdForUpdate("skill-1")).thenReturn(Optional.of(skill));
        when(commentRepository.findByIdForUpdate("comment-1")).thenReturn(Optional.of(parent));
        when(commentRepository.save(any(Comment.class))).thenAnswer(inv -> inv.getArgument(0));

        // Act
        Comment reply = commentService.addComment("skill-1", "did:bob", "Agreed", "comment-1");

        // Assert
        assertEquals("comment-1", reply.getParentCommentId());
        assertEquals("comment-1", reply.getRootCommentId());
        assertEquals(1, reply.getDepth());
        assertEquals("agent-bob", reply.getAuthorId());
        assertEquals(1, parent.getRepliesCount());
        verify(commentRepository).save(parent);
    }

    @Test
    void testAddComment_ParentOnAnotherSkill() {
        // Arrange
        Comment foreign = comment("comment-9", null, "comment-9", 0);
        foreign.setSkillId("skill-2");
        when(identityResolver.resolve("did:bob")).thenReturn(Optional.of(new Identity("agent-bob", "did:bob")));
        when(skillRepository.findByIdForUpdate("skill-1")).thenReturn(Optional.of(skill));
        when(commentRepository.findByIdForUpdate("comment-9")).thenReturn(Optional.of(foreign));

        // Act & Assert
        assertThrows(InvalidRequestException.class,
            () -> commentService.addComment("skill-1", "did:bob", "Agreed", "comment-9"));
        verify(commentRepository, never()).save(any());
        assertEquals(2, skill.getCommentsCount());
    }

    @Test
    void testAddComment_Validation() {
        assertThrows(InvalidRequestException.class, () -> commentService.addComment("skill-1", "did:alice", "   ", null));

        when(identityResolver.resolve("did:ghost")).thenReturn(Optional.empty());
        assertThrows(NotFoundException.class, () -> commentService.addComment("skill-1", "did:ghost", "hi", null));
        verifyNoInteractions(skillRepository, commentRepository);
    }

    @Test
    void testGetCommentTree_NestsRepliesInCreationOrder() {
        // Arrange
        when(skillRepository.findById("skill-1")).thenReturn(Optional.of(skill));
        when(commentRepository.findVisibleBySkillId("skill-1")).thenReturn(Arrays.asList(
            comment("c1", null, "c1", 0),
            comment("c2", "c1", "c1", 1),
            comment("c3", null, "c3", 0),
            comment("c4", "c2", "c1", 2),
            comment("c5", "c-deleted", "c-deleted", 1)));

        // Act
        List<CommentNode> tree = commentService.getCommentTree("skill-1");

        // Assert
        assertEquals(3, tree.size());
        assertEquals("c1", tree.get(0).getCommentId());
        assertEquals("c3", tree.get(1).getCommentId());
        assertEquals("c5", tree.get(2).getCommentId());
        CommentNode c2 = tree.get(0).getReplies().get(0);
        assertEquals("c2", c2.getCommentId());
        assertEquals("c4", c2.getReplies().get(0).getCommentId());
        assertTrue(tree.get(1).getReplies().isEmpty());
    }

    @Test
    void testGetCommentTree_UnknownSkill() {
        when(skillRepository.findById("skill-404")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> commentService.getCommentTree("skill-404"));
    }
}
