package com.community.kolokwa.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VerificationRequest {

    /** accurate | needs_revision | incorrect */
    @NotBlank(message = "Verification type is required")
    @JsonAlias("verification_type")
    private String verificationType;

    @Size(max = 2000)
    private String comments;
}
