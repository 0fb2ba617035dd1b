package com.skillsarena.platform.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageResult {
    private String skillId;
    private String agentId;
    private int recordedUsage;
    private long agentTotalUsage;
    private long skillUsageCount;
    private double avgResponseTime;
}
