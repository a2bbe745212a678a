package com.docspace.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the HMAC keys for access and refresh tokens. The two kinds are signed with different secrets
 * so a refresh token never verifies as an access token.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    /** HS256 needs a key of at least 256 bits. */
    public static final int MIN_KEY_BYTES = 32;

    private final SecretKey accessKey;
    private final SecretKey refreshKey;

    public JwtTokenProvider(
            @Value("${jwt.secret}") String accessSecret,
            @Value("${jwt.refresh-secret}") String refreshSecret
    ) {
        this.accessKey = toKey("jwt.secret", accessSecret);
        this.refreshKey = toKey("jwt.refresh-secret", refreshSecret);
    }

    public SecretKey getAccessKey() {
        return accessKey;
    }

    public SecretKey getRefreshKey() {
        return refreshKey;
    }

    /**
     * Key material for a configured secret: the Base64-decoded bytes when the secret is valid Base64,
     * otherwise its UTF-8 bytes.
     */
    public static byte[] keyBytes(String secretString) {
        try {
            return Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            return secretString.getBytes(StandardCharsets.UTF_8);
        }
    }

    private static SecretKey toKey(String property, String secretString) {
        byte[] keyBytes = keyBytes(secretString);
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException(property + " yields a " + keyBytes.length * 8
                    + "-bit key; HS256 requires at least " + MIN_KEY_BYTES * 8 + " bits");
        }
        return new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }
}
