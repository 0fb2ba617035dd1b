package com.skillsarena.platform.service;

import com.skillsarena.platform.dto.RefreshResult;
import com.skillsarena.platform.model.Comment;
import com.skillsarena.platform.model.Skill;
import com.skillsarena.platform.repository.CommentRepository;
import com.skillsarena.platform.repository.RankingCacheRepository;
import com.skillsarena.platform.repository.SkillRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HotScoreRefreshServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    private SkillRepository skillRepository;

    @Mock
    private CommentRepository commentRepository;

    @Mock
    private RankingCacheRepository rankingCache;

    private HotScoreRefreshService refreshService;

    @BeforeEach
    void setUp() {
        refreshService = new HotScoreRefreshService(skillRepository, commentRepository, rankingCache,
            Clock.fixed(NOW, ZoneOffset.UTC), 2);
    }

    private static Skill skill(String id, int upvotes, Duration age) {
        return Skill.builder().skillId(id).upvotes(upvotes).voteScore(upvotes).createdAt(NOW.minus(age)).build();
    }

    @Test
    void testRefreshHotScores_PagesThroughSkillsAndComments() {
        // Arrange
        when(skillRepository.findPublicSlice(0, 2)).thenReturn(Arrays.asList(
            skill("skill-a", 10, Duration.ofHours(18)), skill("skill-b", 0, Duration.ZERO)));
        when(skillRepository.findPublicSlice(1, 2)).thenReturn(Collections.singletonList(
            skill("skill-c", 100, Duration.ZERO)));
        when(skillRepository.updateHotScore(anyString(), anyDouble())).thenReturn(1);
        Comment comment = Comment.builder().commentId("comment-1").upvotes(10).createdAt(NOW).build();
        when(commentRepository.findVisibleSlice(0, 2)).thenReturn(Collections.singletonList(comment));
        when(commentRepository.updateHotScore("comment-1", 1.0)).thenReturn(1);
        when(rankingCache.isAvailable()).thenReturn(true);

        // Act
        RefreshResult result = refreshService.refreshHotScores();

        // Assert
        assertEquals(4, result.getUpdatedCount());
        assertEquals(3, result.getSkillsUpdated());
        assertEquals(1, result.getCommentsUpdated());
        assertTrue(result.isCacheRefreshed());
        verify(skillRepository).updateHotScore("skill-a", 11.0);
        verify(skillRepository).updateHotScore("skill-b", 0.0);
        verify(skillRepository).updateHotScore("skill-c", 2.0);
        verify(skillRepository, never()).findPublicSlice(2, 2);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Double>> captor = ArgumentCaptor.forClass(Map.class);
        verify(rankingCache).replaceRanking(eq(HotScoreRefreshService.HOT_RANKING_ID), captor.capture());
        assertEquals(3, captor.getValue().size());
        assertEquals(11.0, captor.getValue().get("skill-a"));
    }

    @Test
    void testRefreshHotScores_RedisDownStillWritesDatabase() {
        // Arrange
        when(skillRepository.findPublicSlice(0, 2)).thenReturn(Collections.singletonList(
            skill("skill-a", 1, Duration.ofHours(1))));
        when(skillRepository.updateHotScore(anyString(), anyDouble())).thenReturn(1);
        when(rankingCache.isAvailable()).thenReturn(false);

        // Act
        RefreshResult result = refreshService.refreshHotScores();

        // Assert
        assertEquals(1, result.getUpdatedCount());
        assertFalse(result.isCacheRefreshed());
        verify(rankingCache, never()).replaceRanking(anyString(), anyMap());
    }

    @Test
    void testRefreshHotScores_CacheFailureIsNotPropagated() {
        // Arrange
        when(skillRepository.findPublicSlice(0, 2)).thenReturn(Collections.emptyList());
        when(rankingCache.isAvailable()).thenReturn(true);
        doThrow(new IllegalStateException("Redis connection reset"))
            .when(rankingCache).replaceRanking(anyString(), anyMap());

        // Act
        RefreshResult result = refreshService.refreshHotScores();

        // Assert
        assertEquals(0, result.getUpdatedCount());
        assertFalse(result.isCacheRefreshed());
        assertEquals(NOW, result.getRefreshedAt());
    }

    @Test
    void testRefreshHotScores_FailedRowIsSkipped() {
        // Arrange
        when(skillRepository.findPublicSlice(0, 2)).thenReturn(Arrays.asList(
            skill("skill-a", 1, Duration.ZERO), skill("skill-b", 1, Duration.ZERO)));
        when(skillRepository.findPublicSlice(1, 2)).thenReturn(Collections.emptyList());
        when(skillRepository.updateHotScore("skill-a", 0.0)).thenReturn(1);
        when(skillRepository.updateHotScore("skill-b", 0.0)).thenThrow(new QueryTimeoutException("timeout"));
        when(rankingCache.isAvailable()).thenReturn(false);

        // Act
        RefreshResult result = refreshService.refreshHotScores();

        // Assert
        assertEquals(1, result.getSkillsUpdated());
    }

    @Test
    void testConstructor_RejectsNonPositiveBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> new HotScoreRefreshService(
            skillRepository, commentRepository, rankingCache, Clock.fixed(NOW, ZoneOffset.UTC), 0));
    }
}
