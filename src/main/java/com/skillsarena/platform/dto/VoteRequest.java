package com.skillsarena.platform.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VoteRequest {
    @NotBlank(message = "Target type cannot be blank")
    private String targetType;

    @NotBlank(message = "Target id cannot be blank")
    private String targetId;

    @NotBlank(message = "Action cannot be blank")
    private String action;
}
