package com.skillsarena.platform.repository.impl;

import com.skillsarena.platform.model.UsageRecord;
import com.skillsarena.platform.repository.UsageRecordRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class JpaUsageRecordRepository implements UsageRecordRepository {

    private final UsageRecordJpaRepository jpaRepository;

    @Autowired
    public JpaUsageRecordRepository(UsageRecordJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public UsageRecord save(UsageRecord usageRecord) {
        return jpaRepository.save(usageRecord);
    }

    @Override
    public long sumUsageCount(String skillId, String agentId) {
        return jpaRepository.sumUsageCount(skillId, agentId);
    }
}
