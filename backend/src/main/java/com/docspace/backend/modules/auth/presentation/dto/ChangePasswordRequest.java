package com.docspace.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChangePasswordRequest(
        @NotBlank(message = "currentPassword is required") String currentPassword,
        @NotBlank(message = "newPassword is required") @Size(min = 8, max = 128, message = "newPassword must be 8-128 characters") String newPassword
) {
}
