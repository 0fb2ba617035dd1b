package com.skillsarena.platform.model;

import com.skillsarena.platform.exception.InvalidSortKeyException;

/**
 * Feed orderings. Every key sorts descending on a single skill column.
 */
public enum FeedSortKey {
    HOT("hot", "hotScore"),
    NEW("new", "createdAt"),
    TOP("top", "voteScore"),
    RATING("rating", "rating"),
    USAGE("usage", "usageCount"),
    REVIEWS("reviews", "reviewsCount"),
    UPLOADERS("uploaders", "uploaderCount");

    private final String value;
    private final String property;

    FeedSortKey(String value, String property) {
        this.value = value;
        this.property = property;
    }

    public String getValue() {
        return value;
    }

    /** Entity property the key orders by. */
    public String getProperty() {
        return property;
    }

    public static FeedSortKey fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase();
            if (normalized.equals("latest")) {
                return NEW;
            }
            for (FeedSortKey key : values()) {
                if (key.value.equals(normalized)) {
                    return key;
                }
            }
        }
        throw new InvalidSortKeyException("Invalid sort key: " + value
            + ". Must be one of: hot, new, top, rating, usage, reviews, uploaders");
    }
}
