package com.skillsarena.platform.repository;

import com.skillsarena.platform.dto.FeedFilter;
import com.skillsarena.platform.model.FeedSortKey;
import com.skillsarena.platform.model.Skill;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface SkillRepository {
    Skill save(Skill skill);
    Optional<Skill> findById(String skillId);

    /** Reads the skill row with a write lock held until the surrounding transaction ends. */
    Optional<Skill> findByIdForUpdate(String skillId);

    Optional<Skill> findByContentHashForUpdate(String contentHash);
    Optional<Skill> findByNameAndVersion(String name, String version);
    List<Skill> findAllByIds(Collection<String> skillIds);

    /** One page of public skills ordered by id, for batch jobs. */
    List<Skill> findPublicSlice(int page, int size);

    /**
     * Top public skills by {@code 0.5*rating + 30*min(usage/1000,1) + 20*min(reviews/50,1)},
     * ties by id ascending.
     */
    List<Skill> findOverallPage(int limit);

    /** Writes only the hot_score column. */
    int updateHotScore(String skillId, double hotScore);

    /** Public skills matching the filter, sorted descending on the key, ties by id ascending. */
    List<Skill> findFeedPage(FeedSortKey sortKey, FeedFilter filter, int limit, int offset);

    long countFeed(FeedFilter filter);
}
