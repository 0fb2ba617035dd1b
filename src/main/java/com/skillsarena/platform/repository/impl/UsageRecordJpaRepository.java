package com.skillsarena.platform.repository.impl;

import com.skillsarena.platform.model.UsageRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface UsageRecordJpaRepository extends JpaRepository<UsageRecord, Long> {

    @Query("SELECT COALESCE(SUM(u.usageCount), 0) FROM UsageRecord u "
        + "WHERE u.skillId = :skillId AND u.agentId = :agentId")
    long sumUsageCount(@Param("skillId") String skillId, @Param("agentId") String agentId);
}
