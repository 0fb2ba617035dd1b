package com.skillsarena.platform.model;

import com.skillsarena.platform.exception.InvalidRequestException;

/**
 * Who may see a skill. Feeds, leaderboards and the hot ranking list PUBLIC skills only.
 */
public enum Visibility {
    PUBLIC("public"),
    FOLLOWERS_ONLY("followers_only"),
    PRIVATE("private");

    private final String value;

    Visibility(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** Missing or blank means public. */
    public static Visibility fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            return PUBLIC;
        }
        for (Visibility visibility : values()) {
            if (visibility.value.equalsIgnoreCase(value.trim())) {
                return visibility;
            }
        }
        throw new InvalidRequestException("Invalid visibility: " + value
            + ". Must be one of: public, followers_only, private");
    }
}
