package com.skillsarena.platform.model;

/**
 * Direction of a stored vote. A cancelled vote has no row, so there is no NONE here.
 */
public enum VoteType {
    UPVOTE,
    DOWNVOTE
}
