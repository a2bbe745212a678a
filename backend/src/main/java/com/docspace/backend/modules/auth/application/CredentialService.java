package com.docspace.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import com.docspace.backend.global.error.ProblemException;
import com.docspace.backend.modules.auth.domain.AppUser;
import com.docspace.backend.modules.auth.domain.Department;
import com.docspace.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.docspace.backend.modules.auth.infrastructure.persistence.DepartmentRepository;
import com.docspace.backend.modules.auth.infrastructure.session.ExpiringKeyValueStore;
import com.docspace.backend.modules.auth.infrastructure.session.SessionKeys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Account credentials: registration, email/password verification, password change and reset.
 */
@Service
@Transactional
public class CredentialService {

    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

    private static final String DUMMY_PASSWORD = "docspace-timing-equaliser";

    private final AppUserRepository appUserRepository;
    private final DepartmentRepository departmentRepository;
    private final PasswordEncoder passwordEncoder;
    private final ExpiringKeyValueStore store;
    private final TokenSessionService tokenSessionService;
    private final PasswordResetNotifier passwordResetNotifier;
    private final Duration passwordResetTtl;
    private final Clock clock;
    private final String dummyHash;

    public CredentialService(
            AppUserRepository appUserRepository,
            DepartmentRepository departmentRepository,
            PasswordEncoder passwordEncoder,
            ExpiringKeyValueStore store,
            TokenSessionService tokenSessionService,
            PasswordResetNotifier passwordResetNotifier,
            @Value("${app.auth.password-reset-ttl:PT1H}") Duration passwordResetTtl,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.departmentRepository = departmentRepository;
        this.passwordEncoder = passwordEncoder;
        this.store = store;
        this.tokenSessionService = tokenSessionService;
        this.passwordResetNotifier = passwordResetNotifier;
        this.passwordResetTtl = passwordResetTtl;
        this.clock = clock;
        this.dummyHash = passwordEncoder.encode(DUMMY_PASSWORD);
    }

    public AppUser register(String email, String password, String firstName, String lastName, UUID departmentId) {
        String normalizedEmail = normalizeEmail(email);
        if (appUserRepository.existsByEmailIgnoreCase(normalizedEmail)) {
            throw ProblemException.conflict("EMAIL_ALREADY_EXISTS");
        }
        Department department = departmentRepository.findByIdAndActiveTrue(departmentId)
                .orElseThrow(() -> ProblemException.badRequest("INVALID_DEPARTMENT"));

        AppUser user = new AppUser();
        user.setEmail(normalizedEmail);
        user.setPasswordHash(passwordEncoder.encode(password));
        user.setFirstName(firstName.trim());
        user.setLastName(lastName.trim());
        user.setDepartment(department);
        user.setActive(true);

        AppUser saved = appUserRepository.save(user);
        log.info("User {} registered in department {}", saved.getId(), department.getId());
        return saved;
    }

    /**
     * Checks an email/password pair. Unknown email, inactive account and wrong password are
     * indistinguishable to the caller.
     */
    public AppUser verify(String email, String password) {
        Optional<AppUser> candidate = appUserRepository.findByEmailIgnoreCase(normalizeEmail(email));
        if (candidate.isEmpty()) {
            passwordEncoder.matches(password, dummyHash);
            log.info("Login failed: unknown email");
            throw ProblemException.unauthorized("INVALID_CREDENTIALS");
        }

        AppUser user = candidate.get();
        boolean matches = passwordEncoder.matches(password, user.getPasswordHash());
        if (!matches || !user.isActive()) {
            log.info("Login failed for user {}", user.getId());
            throw ProblemException.unauthorized("INVALID_CREDENTIALS");
        }

        user.setLastLoginAt(OffsetDateTime.now(clock));
        return user;
    }

    public void changePassword(UUID userId, String currentPassword, String newPassword) {
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));
        if (!passwordEncoder.matches(currentPassword, user.getPasswordHash())) {
            throw ProblemException.badRequest("CURRENT_PASSWORD_INCORRECT");
        }
        user.setPasswordHash(passwordEncoder.encode(newPassword));
        endSessionsAfterCommit(userId);
        log.info("Password changed for user {}", userId);
    }

    /**
     * Starts a password reset. The outcome is the same whether or not the email is known.
     *
     * @return the reset token when one was issued
     */
    public Optional<String> requestPasswordReset(String email) {
        Optional<AppUser> candidate = appUserRepository.findByEmailIgnoreCase(normalizeEmail(email))
                .filter(AppUser::isActive);
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        AppUser user = candidate.get();
        String resetToken = UUID.randomUUID().toString();
        store.set(SessionKeys.passwordReset(resetToken), user.getId().toString(), passwordResetTtl);
        passwordResetNotifier.sendResetToken(user, resetToken, passwordResetTtl);
        return Optional.of(resetToken);
    }

    /**
     * Consumes a reset token and sets the new password. A token works once.
     */
    public void resetPassword(String resetToken, String newPassword) {
        String userId = store.getAndDelete(SessionKeys.passwordReset(resetToken))
                .orElseThrow(() -> ProblemException.badRequest("INVALID_RESET_TOKEN"));

        AppUser user = parseUuid(userId)
                .flatMap(appUserRepository::findById)
                .orElseThrow(() -> ProblemException.badRequest("INVALID_RESET_TOKEN"));

        user.setPasswordHash(passwordEncoder.encode(newPassword));
        endSessionsAfterCommit(user.getId());
        log.info("Password reset completed for user {}", user.getId());
    }

    /**
     * Sessions end only once the new hash is committed; a rolled-back change leaves them alone.
     */
    private void endSessionsAfterCommit(UUID userId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            tokenSessionService.forceLogoutAllSessions(userId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                tokenSessionService.forceLogoutAllSessions(userId);
            }
        });
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private static Optional<UUID> parseUuid(String value) {
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
