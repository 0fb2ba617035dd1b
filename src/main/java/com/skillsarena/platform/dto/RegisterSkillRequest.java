package com.skillsarena.platform.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterSkillRequest {
    @NotBlank(message = "Content hash cannot be blank")
    @Pattern(regexp = "[0-9a-fA-F]{64}", message = "Content hash must be a SHA-256 hex digest")
    private String contentHash;

    @NotBlank(message = "Name cannot be blank")
    private String name;

    @NotBlank(message = "Version cannot be blank")
    private String version;

    private String description;
    private String community;

    /** public, followers_only or private; defaults to public. */
    private String visibility;
}
