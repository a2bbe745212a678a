package com.docspace.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.docspace.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.docspace.backend.modules.auth.presentation.dto.TokenPairResponse;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import javax.crypto.SecretKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Signs and verifies access and refresh JWTs. Stateless; session bookkeeping lives in
 * {@link TokenSessionService}.
 */
@Service
public class JwtTokenService {

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_EMAIL = "email";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final long refreshTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            @Value("${jwt.refresh-expiration:604800000}") long refreshTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.refreshTokenTtlMillis = refreshTokenTtlMillis;
        this.clock = clock;
    }

    public TokenPairResponse issueTokenPair(UUID userId, String email) {
        Instant now = clock.instant();
        OffsetDateTime issuedAt = OffsetDateTime.ofInstant(now, clock.getZone());

        String accessToken = sign(userId, email, now, now.plusMillis(accessTokenTtlMillis), tokenProvider.getAccessKey());
        String refreshToken = sign(userId, email, now, now.plusMillis(refreshTokenTtlMillis), tokenProvider.getRefreshKey());

        return new TokenPairResponse(
                accessToken,
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                accessTokenTtlMillis / 1000L,
                refreshToken,
                refreshTokenTtlMillis / 1000L,
                issuedAt
        );
    }

    public ParsedToken parseAccessToken(String token) {
        return parse(token, tokenProvider.getAccessKey(), "Invalid access token");
    }

    public ParsedToken parseRefreshToken(String token) {
        return parse(token, tokenProvider.getRefreshKey(), "Invalid refresh token");
    }

    public long getAccessTokenTtlMillis() {
        return accessTokenTtlMillis;
    }

    public long getRefreshTokenTtlMillis() {
        return refreshTokenTtlMillis;
    }

    private String sign(UUID userId, String email, Instant issuedAt, Instant expiresAt, SecretKey key) {
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(userId.toString())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .claim(CLAIM_USER_ID, userId.toString())
                .claim(CLAIM_EMAIL, email)
                .signWith(key, SIG.HS256)
                .compact();
    }

    private ParsedToken parse(String token, SecretKey key, String failureMessage) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException(failureMessage, null);
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID userId = UUID.fromString(claims.getSubject());
            String email = claims.get(CLAIM_EMAIL, String.class);
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            if (claims.getExpiration() == null) {
                throw new InvalidTokenException(failureMessage, null);
            }
            Instant expiresAt = claims.getExpiration().toInstant();

            return new ParsedToken(
                    userId,
                    email,
                    claims.getId(),
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException(failureMessage, e);
        }
    }

    public record ParsedToken(UUID userId, String email, String tokenId, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
