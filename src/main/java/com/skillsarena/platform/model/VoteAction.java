package com.skillsarena.platform.model;

import com.skillsarena.platform.exception.InvalidActionException;

public enum VoteAction {
    UPVOTE("upvote"),
    DOWNVOTE("downvote"),
    CANCEL("cancel");

    private final String value;

    VoteAction(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static VoteAction fromValue(String value) {
        if (value != null) {
            for (VoteAction action : values()) {
                if (action.value.equalsIgnoreCase(value.trim())) {
                    return action;
                }
            }
        }
        throw new InvalidActionException(
            "Invalid vote action: " + value + ". Must be 'upvote', 'downvote', or 'cancel'");
    }
}
