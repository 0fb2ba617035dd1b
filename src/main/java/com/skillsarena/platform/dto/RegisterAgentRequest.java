package com.skillsarena.platform.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterAgentRequest {
    @NotBlank(message = "DID cannot be blank")
    private String did;

    @NotBlank(message = "Username cannot be blank")
    @Size(max = 64, message = "Username cannot exceed 64 characters")
    private String username;

    private String displayName;
    private String bio;
}
