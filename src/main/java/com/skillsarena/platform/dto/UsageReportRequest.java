package com.skillsarena.platform.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UsageReportRequest {
    @NotNull(message = "Usage count cannot be null")
    @Min(value = 0, message = "Usage count cannot be negative")
    private Integer usageCount;

    private double totalTime;
    private double avgResponseTime;
    private double successRate = 1.0;
}
