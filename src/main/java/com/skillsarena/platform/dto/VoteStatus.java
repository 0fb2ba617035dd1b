package com.skillsarena.platform.dto;

import com.skillsarena.platform.model.VoteState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The caller's current vote on a target together with the target's counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoteStatus {
    private boolean success;
    private String message;
    private String targetType;
    private String targetId;
    private VoteState currentVote;
    private int upvotes;
    private int downvotes;
    private int voteScore;

    public static VoteStatus failure(String targetType, String targetId, String message) {
        return VoteStatus.builder()
            .success(false)
            .message(message)
            .targetType(targetType)
            .targetId(targetId)
            .build();
    }
}
