package com.skillsarena.platform.model;

public enum VoteState {
    NONE,
    UPVOTED,
    DOWNVOTED;

    public static VoteState of(VoteType voteType) {
        if (voteType == null) {
            return NONE;
        }
        return voteType == VoteType.UPVOTE ? UPVOTED : DOWNVOTED;
    }

    public VoteType toVoteType() {
        switch (this) {
            case UPVOTED:
                return VoteType.UPVOTE;
            case DOWNVOTED:
                return VoteType.DOWNVOTE;
            default:
                return null;
        }
    }
}
