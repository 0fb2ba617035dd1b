package com.skillsarena.platform.repository;

import com.skillsarena.platform.model.UsageRecord;

public interface UsageRecordRepository {
    UsageRecord save(UsageRecord usageRecord);
    long sumUsageCount(String skillId, String agentId);
}
