package com.docspace.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

import com.docspace.backend.global.error.ProblemException;
import com.docspace.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.docspace.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.docspace.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.docspace.backend.modules.auth.infrastructure.session.ExpiringKeyValueStore;
import com.docspace.backend.modules.auth.infrastructure.session.SessionKeys;
import com.docspace.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Session lifecycle on top of the key-value store: one live refresh token per user, rotated atomically,
 * and a blacklist of revoked access tokens that expires with the tokens themselves.
 */
@Service
public class TokenSessionService {

    private static final Logger log = LoggerFactory.getLogger(TokenSessionService.class);

    static final String BLACKLIST_MARKER = "1";

    private final JwtTokenService jwtTokenService;
    private final ExpiringKeyValueStore store;
    private final AppUserRepository appUserRepository;
    private final Clock clock;

    public TokenSessionService(
            JwtTokenService jwtTokenService,
            ExpiringKeyValueStore store,
            AppUserRepository appUserRepository,
            Clock clock
    ) {
        this.jwtTokenService = jwtTokenService;
        this.store = store;
        this.appUserRepository = appUserRepository;
        this.clock = clock;
    }

    /**
     * Issues a fresh pair and makes its refresh token the user's only valid one.
     */
    public TokenPairResponse issue(UUID userId, String email) {
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(userId, email);
        store.set(SessionKeys.refreshToken(userId), tokens.refreshToken(), refreshTtl());
        return tokens;
    }

    /**
     * Exchanges a refresh token for a new pair. Of several concurrent calls with the same token
     * exactly one succeeds; the rest see {@code INVALID_REFRESH_TOKEN}.
     */
    public TokenPairResponse refresh(String refreshToken) {
        ParsedToken parsed;
        try {
            parsed = jwtTokenService.parseRefreshToken(refreshToken);
        } catch (InvalidTokenException ex) {
            log.info("Refresh rejected: token did not verify");
            throw ProblemException.unauthorized("INVALID_REFRESH_TOKEN");
        }

        UUID userId = parsed.userId();
        boolean active = appUserRepository.findById(userId)
                .map(user -> user.isActive())
                .orElse(false);
        if (!active) {
            log.info("Refresh rejected: user {} missing or inactive", userId);
            throw ProblemException.unauthorized("INVALID_REFRESH_TOKEN");
        }

        TokenPairResponse tokens = jwtTokenService.issueTokenPair(userId, parsed.email());
        boolean rotated = store.compareAndSet(
                SessionKeys.refreshToken(userId),
                refreshToken,
                tokens.refreshToken(),
                refreshTtl()
        );
        if (!rotated) {
            log.info("Refresh rejected: token for user {} is not the current one", userId);
            throw ProblemException.unauthorized("INVALID_REFRESH_TOKEN");
        }
        return tokens;
    }

    /**
     * Blacklists an access token for the rest of its lifetime. Tokens that no longer verify need no marker.
     *
     * @return {@code true} when a marker was written
     */
    public boolean revokeAccessToken(String accessToken) {
        ParsedToken parsed;
        try {
            parsed = jwtTokenService.parseAccessToken(accessToken);
        } catch (InvalidTokenException ex) {
            return false;
        }
        Duration remaining = Duration.between(clock.instant(), parsed.expiresAt().toInstant());
        if (remaining.isZero() || remaining.isNegative()) {
            return false;
        }
        store.set(SessionKeys.blacklist(accessToken), BLACKLIST_MARKER, remaining);
        return true;
    }

    /**
     * Ends the caller's session. Never fails: each step is attempted and problems are only logged.
     * The user is identified from the access token, or from the refresh token when the access token
     * no longer verifies; in the latter case only a refresh token that is still the current one is removed.
     */
    public void logout(String accessToken, String refreshToken) {
        UUID userId = null;
        if (accessToken != null && !accessToken.isBlank()) {
            try {
                userId = jwtTokenService.parseAccessToken(accessToken).userId();
                revokeAccessToken(accessToken);
            } catch (InvalidTokenException ex) {
                log.debug("Logout: access token did not verify");
            } catch (RuntimeException ex) {
                log.warn("Logout: failed to blacklist access token", ex);
            }
        }

        try {
            if (userId != null) {
                store.delete(SessionKeys.refreshToken(userId));
            } else if (refreshToken != null && !refreshToken.isBlank()) {
                userId = jwtTokenService.parseRefreshToken(refreshToken).userId();
                String key = SessionKeys.refreshToken(userId);
                if (store.get(key).filter(refreshToken::equals).isPresent()) {
                    store.delete(key);
                }
            }
        } catch (InvalidTokenException ex) {
            log.debug("Logout: refresh token did not verify");
        } catch (RuntimeException ex) {
            log.warn("Logout: failed to delete refresh token of user {}", userId, ex);
        }

        if (userId != null) {
            log.info("User {} logged out", userId);
        }
    }

    /**
     * Invalidates the stored refresh token. Access tokens already issued stay valid until they expire.
     */
    public void forceLogoutAllSessions(UUID userId) {
        store.delete(SessionKeys.refreshToken(userId));
        log.info("Refresh token of user {} invalidated", userId);
    }

    /**
     * Verifies an access token for a request. The blacklist is consulted on every call.
     */
    public ParsedToken authenticate(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            throw ProblemException.unauthorized("INVALID_ACCESS_TOKEN");
        }
        if (store.exists(SessionKeys.blacklist(accessToken))) {
            throw ProblemException.unauthorized("INVALID_ACCESS_TOKEN");
        }
        try {
            return jwtTokenService.parseAccessToken(accessToken);
        } catch (InvalidTokenException ex) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_ACCESS_TOKEN", null, ex);
        }
    }

    private Duration refreshTtl() {
        return Duration.ofMillis(jwtTokenService.getRefreshTokenTtlMillis());
    }
}
