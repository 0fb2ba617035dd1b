package com.skillsarena.platform.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewResult {
    private String reviewId;
    private String skillId;
    private double weight;
    private boolean burstDamped;
    private double skillRating;
    private int reviewsCount;
}
