package com.skillsarena.platform.repository.impl;

import com.skillsarena.platform.dto.FeedFilter;
import com.skillsarena.platform.model.FeedSortKey;
import com.skillsarena.platform.model.Skill;
import com.skillsarena.platform.model.Visibility;
import com.skillsarena.platform.repository.SkillRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Repository
@Primary
public class JpaSkillRepository implements SkillRepository {

    private static final String OVERALL_SCORE = "(0.5 * s.rating"
        + " + 30 * least(s.usageCount / 1000.0, 1.0)"
        + " + 20 * least(s.reviewsCount / 50.0, 1.0))";

    private final SkillJpaRepository jpaRepository;

    @PersistenceContext
    private EntityManager entityManager;

    @Autowired
    public JpaSkillRepository(SkillJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public Skill save(Skill skill) {
        return jpaRepository.save(skill);
    }

    @Override
    public Optional<Skill> findById(String skillId) {
        return jpaRepository.findById(skillId);
    }

    @Override
    public Optional<Skill> findByIdForUpdate(String skillId) {
        return jpaRepository.findByIdForUpdate(skillId);
    }

    @Override
    public Optional<Skill> findByContentHashForUpdate(String contentHash) {
        return jpaRepository.findByContentHashForUpdate(contentHash);
    }

    @Override
    public Optional<Skill> findByNameAndVersion(String name, String version) {
        return jpaRepository.findFirstByNameAndVersion(name, version);
    }

    @Override
    public List<Skill> findAllByIds(Collection<String> skillIds) {
        return jpaRepository.findAllById(skillIds);
    }

    @Override
    public List<Skill> findPublicSlice(int page, int size) {
        return jpaRepository.findByVisibilityOrderBySkillIdAsc(Visibility.PUBLIC, PageRequest.of(page, size));
    }

    @Override
    public List<Skill> findOverallPage(int limit) {
        TypedQuery<Skill> query = entityManager.createQuery(
            "SELECT s FROM Skill s WHERE s.visibility = :visibility"
                + " ORDER BY " + OVERALL_SCORE + " DESC, s.skillId ASC", Skill.class);
        query.setParameter("visibility", Visibility.PUBLIC);
        query.setMaxResults(limit);
        return query.getResultList();
    }

    @Override
    public int updateHotScore(String skillId, double hotScore) {
        return jpaRepository.updateHotScore(skillId, hotScore);
    }

    @Override
    public List<Skill> findFeedPage(FeedSortKey sortKey, FeedFilter filter, int limit, int offset) {
        Map<String, Object> params = new HashMap<>();
        // Sort property comes from the enum, never from caller input
        String jpql = "SELECT s FROM Skill s" + whereClause(filter, params)
            + " ORDER BY s." + sortKey.getProperty() + " DESC, s.skillId ASC";

        TypedQuery<Skill> query = entityManager.createQuery(jpql, Skill.class);
        params.forEach(query::setParameter);
        query.setFirstResult(offset);
        query.setMaxResults(limit);
        return query.getResultList();
    }

    @Override
    public long countFeed(FeedFilter filter) {
        Map<String, Object> params = new HashMap<>();
        String jpql = "SELECT COUNT(s) FROM Skill s" + whereClause(filter, params);

        TypedQuery<Long> query = entityManager.createQuery(jpql, Long.class);
        params.forEach(query::setParameter);
        return query.getSingleResult();
    }

    private static String whereClause(FeedFilter filter, Map<String, Object> params) {
        List<String> conditions = new ArrayList<>();
        conditions.add("s.visibility = :visibility");
        params.put("visibility", Visibility.PUBLIC);

        if (filter != null) {
            if (hasText(filter.getCommunity())) {
                conditions.add("s.community = :community");
                params.put("community", filter.getCommunity().trim());
            }
            if (hasText(filter.getQuery())) {
                conditions.add("(LOWER(s.name) LIKE :query OR LOWER(s.description) LIKE :query)");
                params.put("query", "%" + filter.getQuery().trim().toLowerCase(Locale.ROOT) + "%");
            }
            if (filter.getMinRating() != null) {
                conditions.add("s.rating >= :minRating");
                params.put("minRating", filter.getMinRating());
            }
            if (filter.getMinUsage() != null) {
                conditions.add("s.usageCount >= :minUsage");
                params.put("minUsage", filter.getMinUsage());
            }
        }
        return " WHERE " + String.join(" AND ", conditions);
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
