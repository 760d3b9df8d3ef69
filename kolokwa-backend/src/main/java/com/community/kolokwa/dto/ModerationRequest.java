package com.community.kolokwa.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModerationRequest {

    /** pending | verified | rejected | needs_revision */
    @NotBlank(message = "Status is required")
    private String status;
}
