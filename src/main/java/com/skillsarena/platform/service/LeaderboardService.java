package com.skillsarena.platform.service;

import com.skillsarena.platform.dto.FeedFilter;
import com.skillsarena.platform.dto.LeaderboardPage;
import com.skillsarena.platform.dto.RankedSkill;
import com.skillsarena.platform.dto.SkillSummary;
import com.skillsarena.platform.exception.InvalidRequestException;
import com.skillsarena.platform.model.LeaderboardCategory;
import com.skillsarena.platform.model.Skill;
import com.skillsarena.platform.repository.SkillRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Service
public class LeaderboardService {

    static final double USAGE_CAP = 1000.0;
    static final double REVIEWS_CAP = 50.0;

    private final SkillRepository skillRepository;
    private final Clock clock;
    private final int defaultLimit;
    private final int maxLimit;

    @Autowired
    public LeaderboardService(
            SkillRepository skillRepository,
            Clock clock,
            @Value("${skillsarena.feed.default-limit:50}") int defaultLimit,
            @Value("${skillsarena.feed.max-limit:500}") int maxLimit) {
        this.skillRepository = skillRepository;
        this.clock = clock;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    public LeaderboardPage composeLeaderboard(String category, Integer limit) {
        LeaderboardCategory resolved = LeaderboardCategory.fromValue(category);
        int pageLimit = limit != null ? limit : defaultLimit;
        if (pageLimit <= 0 || pageLimit > maxLimit) {
            throw new InvalidRequestException("Limit must be between 1 and " + maxLimit);
        }

        List<Skill> ranked;
        if (resolved == LeaderboardCategory.OVERALL) {
            ranked = skillRepository.findOverallPage(pageLimit);
        } else {
            ranked = skillRepository.findFeedPage(resolved.getSortKey(), FeedFilter.none(), pageLimit, 0);
        }

        List<RankedSkill> entries = new ArrayList<>(ranked.size());
        int rank = 1;
        for (Skill skill : ranked) {
            entries.add(RankedSkill.builder()
                .rank(rank++)
                .score(scoreOf(resolved, skill))
                .skill(SkillSummary.from(skill))
                .build());
        }

        return LeaderboardPage.builder()
            .category(resolved.getValue())
            .entries(entries)
            .limit(pageLimit)
            .retrievedAt(clock.instant())
            .build();
    }

    /**
     * Same expression the repository orders the overall leaderboard by:
     * {@code 0.5 * rating + 30 * min(usage / 1000, 1) + 20 * min(reviews / 50, 1)}, at most 100.
     */
    public static double overallScore(Skill skill) {
        double ratingPart = 0.5 * skill.getRating();
        double usagePart = 0.3 * Math.min(skill.getUsageCount() / USAGE_CAP, 1.0) * 100;
        double reviewsPart = 0.2 * Math.min(skill.getReviewsCount() / REVIEWS_CAP, 1.0) * 100;
        return ratingPart + usagePart + reviewsPart;
    }

    private static double scoreOf(LeaderboardCategory category, Skill skill) {
        switch (category) {
            case OVERALL:
                return overallScore(skill);
            case RATING:
                return skill.getRating();
            case USAGE:
                return skill.getUsageCount();
            case REVIEWS:
                return skill.getReviewsCount();
            case UPLOADERS:
                return skill.getUploaderCount();
            default:
                throw new IllegalArgumentException("Unsupported leaderboard category: " + category);
        }
    }
}
