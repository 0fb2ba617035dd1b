package com.skillsarena.platform.dto;

import com.skillsarena.platform.model.VoteOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SkillRegistration {

    public enum Status {
        NEW,
        DUPLICATE
    }

    private Status status;
    private String skillId;
    private int uploaderCount;
    private String message;

    /** Set only for a duplicate upload by someone other than the original uploader. */
    private VoteOutcome autoVote;
}
