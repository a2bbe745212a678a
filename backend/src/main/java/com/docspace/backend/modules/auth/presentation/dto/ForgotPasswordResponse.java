package com.docspace.backend.modules.auth.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForgotPasswordResponse(String message, String resetToken) {

    public static final String GENERIC_MESSAGE = "If the email exists, a password reset link has been sent";
}
