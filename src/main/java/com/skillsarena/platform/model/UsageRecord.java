package com.skillsarena.platform.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only usage log entry.
 */
@Entity
@Table(name = "usage_records", indexes = {
    @Index(name = "idx_usage_skill_agent", columnList = "skill_id,agent_id"),
    @Index(name = "idx_usage_recorded_at", columnList = "recorded_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "skill_id", nullable = false, updatable = false)
    private String skillId;

    @Column(name = "agent_id", nullable = false, updatable = false)
    private String agentId;

    @Column(name = "usage_count", nullable = false, updatable = false)
    private int usageCount;

    @Column(name = "total_time", nullable = false, updatable = false)
    private double totalTime;

    @Column(name = "avg_response_time", updatable = false)
    private double avgResponseTime;

    @Column(name = "success_rate", updatable = false)
    private double successRate;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;
}
