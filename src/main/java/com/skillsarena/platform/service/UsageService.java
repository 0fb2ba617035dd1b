package com.skillsarena.platform.service;

import com.skillsarena.platform.config.TransactionalRetryExecutor;
import com.skillsarena.platform.dto.UsageResult;
import com.skillsarena.platform.exception.InvalidRequestException;
import com.skillsarena.platform.exception.NotFoundException;
import com.skillsarena.platform.model.Identity;
import com.skillsarena.platform.model.Skill;
import com.skillsarena.platform.model.UsageRecord;
import com.skillsarena.platform.repository.SkillRepository;
import com.skillsarena.platform.repository.UsageRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
public class UsageService {

    private static final Logger logger = LoggerFactory.getLogger(UsageService.class);

    private final UsageRecordRepository usageRecordRepository;
    private final SkillRepository skillRepository;
    private final IdentityResolver identityResolver;
    private final TransactionalRetryExecutor retryExecutor;
    private final Clock clock;

    @Autowired
    public UsageService(
            UsageRecordRepository usageRecordRepository,
            SkillRepository skillRepository,
            IdentityResolver identityResolver,
            TransactionalRetryExecutor retryExecutor,
            Clock clock) {
        this.usageRecordRepository = usageRecordRepository;
        this.skillRepository = skillRepository;
        this.identityResolver = identityResolver;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    /**
     * Appends a usage record and folds it into the skill's usage totals.
     */
    public UsageResult recordUsage(String skillId, String callerToken, Integer usageCount,
                                   double totalTime, double avgResponseTime, double successRate) {
        validateUsage(usageCount, totalTime, avgResponseTime, successRate);
        Identity identity = identityResolver.resolve(callerToken)
            .orElseThrow(NotFoundException::identity);

        return retryExecutor.execute("recordUsage", () -> {
            Skill skill = skillRepository.findByIdForUpdate(skillId)
                .orElseThrow(() -> NotFoundException.skill(skillId));

            Instant now = clock.instant();
            usageRecordRepository.save(UsageRecord.builder()
                .skillId(skillId)
                .agentId(identity.getAgentId())
                .usageCount(usageCount)
                .totalTime(totalTime)
                .avgResponseTime(avgResponseTime)
                .successRate(successRate)
                .recordedAt(now)
                .build());

            skill.setUsageCount(skill.getUsageCount() + usageCount);
            skill.setTotalUsageTime(skill.getTotalUsageTime() + totalTime);
            if (skill.getUsageCount() > 0) {
                skill.setAvgResponseTime(skill.getTotalUsageTime() / skill.getUsageCount());
            }
            skill.setUpdatedAt(now);
            skillRepository.save(skill);

            long agentTotal = usageRecordRepository.sumUsageCount(skillId, identity.getAgentId());
            logger.info("Recorded {} uses of skill {} by agent {} (agent total {}, skill total {})",
                usageCount, skillId, identity.getAgentId(), agentTotal, skill.getUsageCount());

            return UsageResult.builder()
                .skillId(skillId)
                .agentId(identity.getAgentId())
                .recordedUsage(usageCount)
                .agentTotalUsage(agentTotal)
                .skillUsageCount(skill.getUsageCount())
                .avgResponseTime(skill.getAvgResponseTime())
                .build();
        });
    }

    private void validateUsage(Integer usageCount, double totalTime, double avgResponseTime, double successRate) {
        if (usageCount == null) {
            throw new InvalidRequestException("Usage count cannot be null");
        }
        if (usageCount < 0) {
            throw new InvalidRequestException("Usage count cannot be negative");
        }
        if (totalTime < 0 || Double.isNaN(totalTime)) {
            throw new InvalidRequestException("Total time cannot be negative");
        }
        if (avgResponseTime < 0 || Double.isNaN(avgResponseTime)) {
            throw new InvalidRequestException("Average response time cannot be negative");
        }
        if (successRate < 0 || successRate > 1 || Double.isNaN(successRate)) {
            throw new InvalidRequestException("Success rate must be between 0 and 1");
        }
    }
}
