package com.skillsarena.platform.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedSkill {
    private int rank;
    private double score;
    private SkillSummary skill;
}
