package com.skillsarena.platform.controller;

import com.skillsarena.platform.dto.FeedFilter;
import com.skillsarena.platform.dto.FeedPage;
import com.skillsarena.platform.dto.LeaderboardPage;
import com.skillsarena.platform.dto.RefreshResult;
import com.skillsarena.platform.service.FeedService;
import com.skillsarena.platform.service.HotScoreRefreshService;
import com.skillsarena.platform.service.LeaderboardService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v2")
public class FeedController {

    private static final Logger logger = LoggerFactory.getLogger(FeedController.class);

    private final FeedService feedService;
    private final LeaderboardService leaderboardService;
    private final HotScoreRefreshService hotScoreRefreshService;

    @Autowired
    public FeedController(
            FeedService feedService,
            LeaderboardService leaderboardService,
            HotScoreRefreshService hotScoreRefreshService) {
        this.feedService = feedService;
        this.leaderboardService = leaderboardService;
        this.hotScoreRefreshService = hotScoreRefreshService;
    }

    /**
     * Ranked feed of public skills.
     * GET /api/v2/feed?sort=hot&community=...&q=...&minRating=...&minUsage=...&limit=N&offset=M
     */
    @GetMapping("/feed")
    public ResponseEntity<FeedPage> getFeed(
            @RequestParam(defaultValue = "hot") String sort,
            @RequestParam(required = false) String community,
            @RequestParam(name = "q", required = false) String query,
            @RequestParam(required = false) Double minRating,
            @RequestParam(required = false) Long minUsage,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {

        logger.info("Received GET request for feed - sort: {}, limit: {}, offset: {}", sort, limit, offset);

        FeedFilter filter = FeedFilter.builder()
            .community(community)
            .query(query)
            .minRating(minRating)
            .minUsage(minUsage)
            .build();
        try {
            return ResponseEntity.ok(feedService.composeFeed(sort, filter, limit, offset));
        } catch (Exception e) {
            logger.error("Error composing feed - sort: {}, error: {}", sort, e.getMessage());
            throw e;
        }
    }

    /**
     * Leaderboard by category.
     * GET /api/v2/leaderboards/{category}?limit=N
     */
    @GetMapping("/leaderboards/{category}")
    public ResponseEntity<LeaderboardPage> getLeaderboard(
            @PathVariable String category,
            @RequestParam(required = false) Integer limit) {

        logger.info("Received GET request for leaderboard - category: {}, limit: {}", category, limit);

        try {
            return ResponseEntity.ok(leaderboardService.composeLeaderboard(category, limit));
        } catch (Exception e) {
            logger.error("Error composing leaderboard - category: {}, error: {}", category, e.getMessage());
            throw e;
        }
    }

    /**
     * Recompute hot scores now instead of waiting for the schedule.
     * POST /api/v2/feed/hot-scores/refresh
     */
    @PostMapping("/feed/hot-scores/refresh")
    public ResponseEntity<RefreshResult> refreshHotScores() {
        logger.info("Received POST request to refresh hot scores");
        RefreshResult result = hotScoreRefreshService.refreshHotScores();
        logger.info("Hot scores refreshed - updated: {}", result.getUpdatedCount());
        return ResponseEntity.ok(result);
    }
}
