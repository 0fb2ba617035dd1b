package com.skillsarena.platform.model;

import com.skillsarena.platform.exception.InvalidSortKeyException;

public enum LeaderboardCategory {
    OVERALL("overall", null),
    RATING("rating", FeedSortKey.RATING),
    USAGE("usage", FeedSortKey.USAGE),
    REVIEWS("reviews", FeedSortKey.REVIEWS),
    UPLOADERS("uploaders", FeedSortKey.UPLOADERS);

    private final String value;
    private final FeedSortKey sortKey;

    LeaderboardCategory(String value, FeedSortKey sortKey) {
        this.value = value;
        this.sortKey = sortKey;
    }

    public String getValue() {
        return value;
    }

    /** Column ordering for single-field categories; null for the composite. */
    public FeedSortKey getSortKey() {
        return sortKey;
    }

    public static LeaderboardCategory fromValue(String value) {
        if (value != null) {
            for (LeaderboardCategory category : values()) {
                if (category.value.equalsIgnoreCase(value.trim())) {
                    return category;
                }
            }
        }
        throw new InvalidSortKeyException("Unknown leaderboard category: " + value
            + ". Must be one of: overall, rating, usage, reviews, uploaders");
    }
}
