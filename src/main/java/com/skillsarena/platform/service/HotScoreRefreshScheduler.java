package com.skillsarena.platform.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class HotScoreRefreshScheduler {

    private static final Logger logger = LoggerFactory.getLogger(HotScoreRefreshScheduler.class);

    private final HotScoreRefreshService refreshService;

    @Autowired
    public HotScoreRefreshScheduler(HotScoreRefreshService refreshService) {
        this.refreshService = refreshService;
    }

    /**
     * Refresh hot scores every five minutes by default.
     */
    @Scheduled(fixedDelayString = "${skillsarena.hot-score.refresh-interval-ms:300000}",
        initialDelayString = "${skillsarena.hot-score.initial-delay-ms:30000}")
    public void refreshHotScores() {
        try {
            refreshService.refreshHotScores();
        } catch (Exception e) {
            logger.error("Error refreshing hot scores", e);
        }
    }
}
