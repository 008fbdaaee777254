package com.mingle.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the HMAC key used to sign and verify bearer tokens.
 * {@code jwt.secret} may be Base64 or a plain string.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final int MIN_KEY_BYTES = 32;

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secretString) {
        this.secretKey = new SecretKeySpec(decode(secretString), HMAC_SHA_256);
    }

    private static byte[] decode(String secretString) {
        byte[] raw = secretString.getBytes(StandardCharsets.UTF_8);
        try {
            byte[] decoded = Base64.getDecoder().decode(secretString);
            // plain strings can happen to be valid Base64; only trust a full-length key
            return decoded.length >= MIN_KEY_BYTES ? decoded : raw;
        } catch (IllegalArgumentException ex) {
            return raw;
        }
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}
