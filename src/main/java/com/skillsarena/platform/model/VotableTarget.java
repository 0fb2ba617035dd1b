package com.skillsarena.platform.model;

import java.time.Instant;

/**
 * A row that carries denormalized vote counters: a skill or a comment.
 */
public interface VotableTarget {

    TargetType getTargetType();

    String getTargetId();

    int getUpvotes();

    void setUpvotes(int upvotes);

    int getDownvotes();

    void setDownvotes(int downvotes);

    int getVoteScore();

    void setVoteScore(int voteScore);

    double getHotScore();

    Instant getCreatedAt();

    /**
     * Applies counter deltas and recomputes {@code voteScore} from the counters,
     * so the score is always {@code upvotes - downvotes}.
     */
    default void applyVoteDelta(int upvoteDelta, int downvoteDelta) {
        int upvotes = getUpvotes() + upvoteDelta;
        int downvotes = getDownvotes() + downvoteDelta;
        if (upvotes < 0 || downvotes < 0) {
            throw new IllegalStateException("Vote counters would go negative for "
                + getTargetType().getValue() + " " + getTargetId()
                + " (upvotes=" + upvotes + ", downvotes=" + downvotes + ")");
        }
        setUpvotes(upvotes);
        setDownvotes(downvotes);
        setVoteScore(upvotes - downvotes);
    }
}
