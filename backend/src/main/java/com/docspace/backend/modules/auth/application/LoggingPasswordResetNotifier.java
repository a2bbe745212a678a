package com.docspace.backend.modules.auth.application;

import java.time.Duration;

import com.docspace.backend.modules.auth.domain.AppUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default notifier used until a delivery channel is configured. Records the request without the token.
 */
@Component
public class LoggingPasswordResetNotifier implements PasswordResetNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingPasswordResetNotifier.class);

    @Override
    public void sendResetToken(AppUser user, String resetToken, Duration validFor) {
        log.info("Password reset requested for user {} (valid for {} minutes)", user.getId(), validFor.toMinutes());
    }
}
