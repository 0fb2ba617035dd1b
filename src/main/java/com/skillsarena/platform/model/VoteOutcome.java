package com.skillsarena.platform.model;

public enum VoteOutcome {
    UPVOTED("Successfully upvoted"),
    DOWNVOTED("Successfully downvoted"),
    ALREADY_UPVOTED("Already upvoted"),
    ALREADY_DOWNVOTED("Already downvoted"),
    CHANGED_TO_UPVOTE("Changed from downvote to upvote"),
    CHANGED_TO_DOWNVOTE("Changed from upvote to downvote"),
    CANCELLED("Vote cancelled"),
    NO_VOTE_TO_CANCEL("No vote to cancel");

    private final String message;

    VoteOutcome(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
