package com.skillsarena.platform.service;

import com.skillsarena.platform.dto.ReviewResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against an in-memory H2 database so the row locks are real.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE, properties = {
        "spring.datasource.url=jdbc:h2:mem:review-burst;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000",
        "spring.datasource.driver-class-name=org.h2.Driver",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.jpa.hibernate.ddl-auto=create-drop",
        "redis.enabled=false",
        "skillsarena.hot-score.initial-delay-ms=3600000"
})
class ConcurrentReviewBurstTest {

    private static final int ROUNDS = 5;
    private static final int REVIEWS_PER_ROUND = 3;

    @Autowired
    private AgentIdentityService agentIdentityService;

    @Autowired
    private SkillRegistryService skillRegistryService;

    @Autowired
    private UsageService usageService;

    @Autowired
    private ReviewService reviewService;

    @Test
    void testSubmitReview_ParallelReviewsByOneAgentAreStillDamped() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(REVIEWS_PER_ROUND);
        try {
            for (int round = 0; round < ROUNDS; round++) {
                // Arrange
                String suffix = UUID.randomUUID().toString().substring(0, 8);
                String did = "did:arena:burst-" + suffix;
                agentIdentityService.registerAgent(did, "burst-" + suffix, null, null);

                List<String> skillIds = new ArrayList<>();
                for (int i = 0; i < REVIEWS_PER_ROUND; i++) {
                    String hash = String.format("%056d", i) + suffix;
                    String skillId = skillRegistryService.registerSkill(hash, "burst-skill-" + suffix + "-" + i,
                        "1.0.0", null, null, null, did).getSkillId();
                    usageService.recordUsage(skillId, did, 5, 1.0, 0.2, 1.0);
                    skillIds.add(skillId);
                }

                // Act
                CyclicBarrier barrier = new CyclicBarrier(REVIEWS_PER_ROUND);
                List<Future<ReviewResult>> futures = new ArrayList<>();
                for (String skillId : skillIds) {
                    futures.add(executor.submit(() -> {
                        barrier.await(10, TimeUnit.SECONDS);
                        return reviewService.submitReview(skillId, did, 80.0, null);
                    }));
                }

                // Assert
                int damped = 0;
                for (Future<ReviewResult> future : futures) {
                    ReviewResult result = future.get(30, TimeUnit.SECONDS);
                    if (result.isBurstDamped()) {
                        damped++;
                        assertEquals(0.1, result.getWeight(), 1e-9);
                    } else {
                        assertEquals(1.0, result.getWeight(), 1e-9);
                    }
                }
                assertEquals(1, damped, "round " + round);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
