package com.docspace.backend.modules.auth.infrastructure.session;

import java.util.UUID;

/**
 * Key layout of session data in the key-value store.
 */
public final class SessionKeys {

    private static final String REFRESH_TOKEN_PREFIX = "refresh_token:";
    private static final String BLACKLIST_PREFIX = "blacklist:";
    private static final String PASSWORD_RESET_PREFIX = "password_reset:";

    private SessionKeys() {
    }

    public static String refreshToken(UUID userId) {
        return REFRESH_TOKEN_PREFIX + userId;
    }

    public static String blacklist(String accessToken) {
        return BLACKLIST_PREFIX + accessToken;
    }

    public static String passwordReset(String resetToken) {
        return PASSWORD_RESET_PREFIX + resetToken;
    }
}
