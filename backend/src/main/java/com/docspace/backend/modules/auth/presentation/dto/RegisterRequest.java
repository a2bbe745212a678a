package com.docspace.backend.modules.auth.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be valid") @Size(max = 320) String email,
        @NotBlank(message = "password is required") @Size(min = 8, max = 128, message = "password must be 8-128 characters") String password,
        @NotBlank(message = "firstName is required") @Size(max = 100) String firstName,
        @NotBlank(message = "lastName is required") @Size(max = 100) String lastName,
        @NotNull(message = "departmentId is required") UUID departmentId
) {
}
