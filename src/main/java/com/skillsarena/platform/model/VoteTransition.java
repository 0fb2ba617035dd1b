package com.skillsarena.platform.model;

import lombok.Value;

/**
 * One edge of the per-(identity, target) vote state machine.
 *
 * <pre>
 * from       action    to         (upvotes, downvotes, score)
 * NONE       upvote    UPVOTED    (+1,  0, +1)
 * NONE       downvote  DOWNVOTED  ( 0, +1, -1)
 * UPVOTED    upvote    UPVOTED    ( 0,  0,  0)  no-op
 * DOWNVOTED  downvote  DOWNVOTED  ( 0,  0,  0)  no-op
 * UPVOTED    downvote  DOWNVOTED  (-1, +1, -2)
 * DOWNVOTED  upvote    UPVOTED    (+1, -1, +2)
 * UPVOTED    cancel    NONE       (-1,  0, -1)
 * DOWNVOTED  cancel    NONE       ( 0, -1, +1)
 * NONE       cancel    NONE       ( 0,  0,  0)  no-op
 * </pre>
 */
@Value
public class VoteTransition {
    VoteState from;
    VoteState to;
    int upvoteDelta;
    int downvoteDelta;
    VoteOutcome outcome;

    public static VoteTransition of(VoteState from, VoteAction action) {
        if (from == null || action == null) {
            throw new IllegalArgumentException("Vote state and action are required");
        }

        switch (action) {
            case UPVOTE:
                if (from == VoteState.UPVOTED) {
                    return new VoteTransition(from, VoteState.UPVOTED, 0, 0, VoteOutcome.ALREADY_UPVOTED);
                }
                if (from == VoteState.DOWNVOTED) {
                    return new VoteTransition(from, VoteState.UPVOTED, 1, -1, VoteOutcome.CHANGED_TO_UPVOTE);
                }
                return new VoteTransition(from, VoteState.UPVOTED, 1, 0, VoteOutcome.UPVOTED);
            case DOWNVOTE:
                if (from == VoteState.DOWNVOTED) {
                    return new VoteTransition(from, VoteState.DOWNVOTED, 0, 0, VoteOutcome.ALREADY_DOWNVOTED);
                }
                if (from == VoteState.UPVOTED) {
                    return new VoteTransition(from, VoteState.DOWNVOTED, -1, 1, VoteOutcome.CHANGED_TO_DOWNVOTE);
                }
                return new VoteTransition(from, VoteState.DOWNVOTED, 0, 1, VoteOutcome.DOWNVOTED);
            case CANCEL:
                if (from == VoteState.UPVOTED) {
                    return new VoteTransition(from, VoteState.NONE, -1, 0, VoteOutcome.CANCELLED);
                }
                if (from == VoteState.DOWNVOTED) {
                    return new VoteTransition(from, VoteState.NONE, 0, -1, VoteOutcome.CANCELLED);
                }
                return new VoteTransition(from, VoteState.NONE, 0, 0, VoteOutcome.NO_VOTE_TO_CANCEL);
            default:
                throw new IllegalArgumentException("Unsupported vote action: " + action);
        }
    }

    public int getScoreDelta() {
        return upvoteDelta - downvoteDelta;
    }

    public boolean isNoOp() {
        return upvoteDelta == 0 && downvoteDelta == 0;
    }
}
