package com.docspace.backend.modules.auth.application;

import java.time.Duration;

import com.docspace.backend.modules.auth.domain.AppUser;

/**
 * Delivers password reset tokens to users. Delivery channels (mail, chat) live outside this service.
 */
public interface PasswordResetNotifier {

    void sendResetToken(AppUser user, String resetToken, Duration validFor);
}
