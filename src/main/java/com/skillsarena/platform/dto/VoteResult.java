package com.skillsarena.platform.dto;

import com.skillsarena.platform.model.VoteOutcome;
import com.skillsarena.platform.model.VoteState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a vote call. An unresolved caller or a missing target yields
 * {@code success=false} instead of an exception.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteResult {
    private boolean success;
    private String message;
    private VoteOutcome outcome;
    private String targetType;
    private String targetId;
    private VoteState currentVote;
    private int upvotes;
    private int downvotes;
    private int voteScore;

    public static VoteResult failure(String targetType, String targetId, String message) {
        return VoteResult.builder()
            .success(false)
            .message(message)
            .targetType(targetType)
            .targetId(targetId)
            .build();
    }
}
