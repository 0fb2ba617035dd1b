package com.skillsarena.platform.repository;

import java.util.List;
import java.util.Map;

/**
 * Precomputed rankings kept outside the database. Callers must treat every
 * operation as best-effort and fall back to persistent storage.
 */
public interface RankingCacheRepository {
    boolean isAvailable();

    /** Atomically replaces the whole ranking with the given member scores. */
    void replaceRanking(String rankingId, Map<String, Double> scores);

    /** Member ids in descending score order, or an empty list if the cache cannot answer. */
    List<String> getRange(String rankingId, int offset, int limit);

    /** Number of ranked members, or {@code null} if the ranking is missing or the cache is down. */
    Long getTotal(String rankingId);
}
