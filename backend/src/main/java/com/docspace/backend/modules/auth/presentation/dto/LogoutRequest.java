package com.docspace.backend.modules.auth.presentation.dto;

/**
 * Optional body of a logout call; the refresh token identifies the session when the access token has expired.
 */
public record LogoutRequest(String refreshToken) {
}
