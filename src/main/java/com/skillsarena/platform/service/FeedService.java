package com.skillsarena.platform.service;

import com.skillsarena.platform.dto.FeedFilter;
import com.skillsarena.platform.dto.FeedPage;
import com.skillsarena.platform.dto.SkillSummary;
import com.skillsarena.platform.exception.InvalidRequestException;
import com.skillsarena.platform.model.FeedSortKey;
import com.skillsarena.platform.model.Skill;
import com.skillsarena.platform.model.Visibility;
import com.skillsarena.platform.repository.RankingCacheRepository;
import com.skillsarena.platform.repository.SkillRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Composes skill feeds. The unfiltered hot feed is read from the Redis ranking
 * when it is available, every other feed from the database.
 * <p>
 * The cached ranking is a snapshot of the last hot-score refresh: skills
 * registered since then are missing from it, {@code total} is the snapshot's
 * size, and equal scores may be ordered differently than the database's
 * {@code skillId} tie-break. Pages can therefore shift when Redis becomes
 * available or unavailable between requests.
 */
@Service
public class FeedService {

    private static final Logger logger = LoggerFactory.getLogger(FeedService.class);

    private final SkillRepository skillRepository;
    private final RankingCacheRepository rankingCache;
    private final Clock clock;
    private final int defaultLimit;
    private final int maxLimit;

    @Autowired
    public FeedService(
            SkillRepository skillRepository,
            RankingCacheRepository rankingCache,
            Clock clock,
            @Value("${skillsarena.feed.default-limit:50}") int defaultLimit,
            @Value("${skillsarena.feed.max-limit:500}") int maxLimit) {
        this.skillRepository = skillRepository;
        this.rankingCache = rankingCache;
        this.clock = clock;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    /**
     * One page of public skills ordered by the sort key, ties by skill id.
     * The unfiltered hot feed is read from Redis when the cached ranking is
     * present and falls back to the database otherwise.
     */
    public FeedPage composeFeed(String sortKey, FeedFilter filter, Integer limit, Integer offset) {
        FeedSortKey key = FeedSortKey.fromValue(sortKey);
        int pageLimit = resolveLimit(limit);
        int pageOffset = resolveOffset(offset);
        FeedFilter effectiveFilter = filter != null ? filter : FeedFilter.none();

        if (key == FeedSortKey.HOT && effectiveFilter.isEmpty()) {
            FeedPage cached = readHotFromCache(pageLimit, pageOffset);
            if (cached != null) {
                return cached;
            }
        }

        List<SkillSummary> items = skillRepository.findFeedPage(key, effectiveFilter, pageLimit, pageOffset)
            .stream()
            .map(SkillSummary::from)
            .collect(Collectors.toList());
        long total = skillRepository.countFeed(effectiveFilter);

        return FeedPage.builder()
            .sortKey(key.getValue())
            .items(items)
            .total(total)
            .limit(pageLimit)
            .offset(pageOffset)
            .servedFromCache(false)
            .retrievedAt(clock.instant())
            .build();
    }

    /**
     * Returns null when the cache cannot serve the page exactly.
     */
    private FeedPage readHotFromCache(int limit, int offset) {
        if (!rankingCache.isAvailable()) {
            return null;
        }

        Long total = rankingCache.getTotal(HotScoreRefreshService.HOT_RANKING_ID);
        if (total == null) {
            return null;
        }
        List<String> ids = rankingCache.getRange(HotScoreRefreshService.HOT_RANKING_ID, offset, limit);
        if (ids.isEmpty() && offset < total) {
            return null;
        }

        Map<String, Skill> byId = skillRepository.findAllByIds(ids).stream()
            .collect(Collectors.toMap(Skill::getSkillId, Function.identity()));
        List<SkillSummary> items = new ArrayList<>(ids.size());
        for (String id : ids) {
            Skill skill = byId.get(id);
            if (skill == null || skill.getVisibility() != Visibility.PUBLIC) {
                logger.warn("Cached hot ranking references missing or hidden skill {}, reading from database", id);
                return null;
            }
            items.add(SkillSummary.from(skill));
        }

        return FeedPage.builder()
            .sortKey(FeedSortKey.HOT.getValue())
            .items(items)
            .total(total)
            .limit(limit)
            .offset(offset)
            .servedFromCache(true)
            .retrievedAt(clock.instant())
            .build();
    }

    int resolveLimit(Integer limit) {
        int resolved = limit != null ? limit : defaultLimit;
        if (resolved <= 0 || resolved > maxLimit) {
            throw new InvalidRequestException("Limit must be between 1 and " + maxLimit);
        }
        return resolved;
    }

    private int resolveOffset(Integer offset) {
        int resolved = offset != null ? offset : 0;
        if (resolved < 0) {
            throw new InvalidRequestException("Offset cannot be negative");
        }
        return resolved;
    }
}
