package com.skillsarena.platform.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedFilter {
    private String community;
    private String query;
    private Double minRating;
    private Long minUsage;

    public static FeedFilter none() {
        return new FeedFilter();
    }

    public boolean isEmpty() {
        return isBlank(community) && isBlank(query) && minRating == null && minUsage == null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
