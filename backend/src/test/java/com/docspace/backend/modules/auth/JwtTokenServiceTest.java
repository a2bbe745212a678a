package com.docspace.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import com.docspace.backend.modules.auth.application.JwtTokenService;
import com.docspace.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.docspace.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.docspace.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.docspace.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.docspace.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    static final String ACCESS_SECRET = "test-access-secret-0123456789abcdef-0123456789";
    static final String REFRESH_SECRET = "test-refresh-secret-0123456789abcdef-0123456789";

    private MutableClock clock;
    private JwtTokenService jwtTokenService;
    private UUID userId;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T09:00:00Z"));
        jwtTokenService = new JwtTokenService(
                new JwtTokenProvider(ACCESS_SECRET, REFRESH_SECRET), 900_000L, 604_800_000L, clock);
        userId = UUID.randomUUID();
    }

    @Test
    void issuedPairCarriesIdentityAndLifetimes() {
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(userId, "u1@example.com");

        assertThat(tokens.tokenType()).isEqualTo("Bearer");
        assertThat(tokens.expiresIn()).isEqualTo(900L);
        assertThat(tokens.refreshExpiresIn()).isEqualTo(604_800L);

        ParsedToken access = jwtTokenService.parseAccessToken(tokens.accessToken());
        assertThat(access.userId()).isEqualTo(userId);
        assertThat(access.email()).isEqualTo("u1@example.com");
        assertThat(access.expiresAt().toInstant()).isEqualTo(Instant.parse("2024-03-01T09:15:00Z"));
        assertThat(access.tokenId()).isNotBlank();
    }

    @Test
    void twoPairsIssuedInTheSameSecondDiffer() {
        TokenPairResponse first = jwtTokenService.issueTokenPair(userId, "u1@example.com");
        TokenPairResponse second = jwtTokenService.issueTokenPair(userId, "u1@example.com");

        assertThat(first.accessToken()).isNotEqualTo(second.accessToken());
        assertThat(first.refreshToken()).isNotEqualTo(second.refreshToken());
    }

    @Test
    void accessAndRefreshTokensAreNotInterchangeable() {
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(userId, "u1@example.com");

        assertThrows(InvalidTokenException.class, () -> jwtTokenService.parseAccessToken(tokens.refreshToken()));
        assertThrows(InvalidTokenException.class, () -> jwtTokenService.parseRefreshToken(tokens.accessToken()));
        assertThat(jwtTokenService.parseRefreshToken(tokens.refreshToken()).userId()).isEqualTo(userId);
    }

    @Test
    void accessTokenExpiresAfterItsLifetime() {
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(userId, "u1@example.com");

        clock.advance(Duration.ofMinutes(14));
        assertThat(jwtTokenService.parseAccessToken(tokens.accessToken()).userId()).isEqualTo(userId);

        clock.advance(Duration.ofMinutes(2));
        assertThrows(InvalidTokenException.class, () -> jwtTokenService.parseAccessToken(tokens.accessToken()));
        assertThat(jwtTokenService.parseRefreshToken(tokens.refreshToken()).userId()).isEqualTo(userId);
    }

    @Test
    void tamperedOrForeignTokensAreRejected() {
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(userId, "u1@example.com");
        String token = tokens.accessToken();
        int signatureStart = token.lastIndexOf('.') + 1;
        char flipped = token.charAt(signatureStart) == 'A' ? 'B' : 'A';
        String tampered = token.substring(0, signatureStart) + flipped + token.substring(signatureStart + 1);

        JwtTokenService foreign = new JwtTokenService(
                new JwtTokenProvider("another-access-secret-0123456789abcdef-xyz", REFRESH_SECRET),
                900_000L, 604_800_000L, clock);
        String foreignToken = foreign.issueTokenPair(userId, "u1@example.com").accessToken();

        assertThrows(InvalidTokenException.class, () -> jwtTokenService.parseAccessToken(tampered));
        assertThrows(InvalidTokenException.class, () -> jwtTokenService.parseAccessToken(foreignToken));
        assertThrows(InvalidTokenException.class, () -> jwtTokenService.parseAccessToken("not-a-jwt"));
        assertThrows(InvalidTokenException.class, () -> jwtTokenService.parseAccessToken(" "));
    }

    @Test
    void secretTooShortForHs256FailsAtConstruction() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new JwtTokenProvider("0123456789abcdef0123456789abcdef", REFRESH_SECRET));

        assertThat(ex).hasMessageContaining("jwt.secret yields a 192-bit key");
    }

    @Test
    void base64SecretOfThirtyTwoBytesSignsAndVerifies() {
        JwtTokenService base64Keyed = new JwtTokenService(
                new JwtTokenProvider("MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=", REFRESH_SECRET),
                900_000L, 604_800_000L, clock);

        String token = base64Keyed.issueTokenPair(userId, "u1@example.com").accessToken();

        assertThat(base64Keyed.parseAccessToken(token).userId()).isEqualTo(userId);
    }
}
