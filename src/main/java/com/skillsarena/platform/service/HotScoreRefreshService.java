package com.skillsarena.platform.service;

import com.skillsarena.platform.dto.RefreshResult;
import com.skillsarena.platform.model.Comment;
import com.skillsarena.platform.model.Skill;
import com.skillsarena.platform.repository.CommentRepository;
import com.skillsarena.platform.repository.RankingCacheRepository;
import com.skillsarena.platform.repository.SkillRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Batch recomputation of hot scores. Votes never touch {@code hot_score};
 * only this refresh writes it.
 */
@Service
public class HotScoreRefreshService {

    private static final Logger logger = LoggerFactory.getLogger(HotScoreRefreshService.class);

    public static final String HOT_RANKING_ID = "skills:hot";

    private final SkillRepository skillRepository;
    private final CommentRepository commentRepository;
    private final RankingCacheRepository rankingCache;
    private final Clock clock;
    private final int batchSize;

    @Autowired
    public HotScoreRefreshService(
            SkillRepository skillRepository,
            CommentRepository commentRepository,
            RankingCacheRepository rankingCache,
            Clock clock,
            @Value("${skillsarena.hot-score.batch-size:500}") int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("hot-score batch-size must be positive");
        }
        this.skillRepository = skillRepository;
        this.commentRepository = commentRepository;
        this.rankingCache = rankingCache;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    /**
     * Recomputes and persists the hot score of every public skill and every
     * visible comment, then rebuilds the cached hot ranking if Redis is up.
     */
    public RefreshResult refreshHotScores() {
        Instant now = clock.instant();
        Map<String, Double> skillScores = new HashMap<>();

        int skillsUpdated = 0;
        for (int page = 0; ; page++) {
            List<Skill> slice = skillRepository.findPublicSlice(page, batchSize);
            for (Skill skill : slice) {
                double hotScore = HotScoreCalculator.compute(
                    skill.getUpvotes(), skill.getDownvotes(), skill.getCreatedAt(), now);
                if (writeSkillScore(skill.getSkillId(), hotScore)) {
                    skillsUpdated++;
                    skillScores.put(skill.getSkillId(), hotScore);
                }
            }
            if (slice.size() < batchSize) {
                break;
            }
        }

        int commentsUpdated = 0;
        for (int page = 0; ; page++) {
            List<Comment> slice = commentRepository.findVisibleSlice(page, batchSize);
            for (Comment comment : slice) {
                double hotScore = HotScoreCalculator.compute(
                    comment.getUpvotes(), comment.getDownvotes(), comment.getCreatedAt(), now);
                if (writeCommentScore(comment.getCommentId(), hotScore)) {
                    commentsUpdated++;
                }
            }
            if (slice.size() < batchSize) {
                break;
            }
        }

        boolean cacheRefreshed = rebuildCache(skillScores);
        logger.info("Hot score refresh complete: {} skills, {} comments, cache refreshed: {}",
            skillsUpdated, commentsUpdated, cacheRefreshed);

        return RefreshResult.builder()
            .updatedCount(skillsUpdated + commentsUpdated)
            .skillsUpdated(skillsUpdated)
            .commentsUpdated(commentsUpdated)
            .cacheRefreshed(cacheRefreshed)
            .refreshedAt(now)
            .build();
    }

    private boolean writeSkillScore(String skillId, double hotScore) {
        try {
            return skillRepository.updateHotScore(skillId, hotScore) > 0;
        } catch (DataAccessException e) {
            logger.warn("Failed to write hot score for skill {}, keeping previous value", skillId, e);
            return false;
        }
    }

    private boolean writeCommentScore(String commentId, double hotScore) {
        try {
            return commentRepository.updateHotScore(commentId, hotScore) > 0;
        } catch (DataAccessException e) {
            logger.warn("Failed to write hot score for comment {}, keeping previous value", commentId, e);
            return false;
        }
    }

    private boolean rebuildCache(Map<String, Double> skillScores) {
        if (!rankingCache.isAvailable()) {
            logger.warn("Redis is not available, hot feed will be served from the database");
            return false;
        }
        try {
            rankingCache.replaceRanking(HOT_RANKING_ID, skillScores);
            return true;
        } catch (Exception e) {
            logger.error("Failed to rebuild hot ranking in Redis", e);
            return false;
        }
    }
}
