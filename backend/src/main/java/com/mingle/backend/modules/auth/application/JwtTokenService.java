package com.mingle.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.mingle.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies stateless HS256 bearer tokens. Expiry is checked against the
 * application {@link Clock}, the same source used for post expiry.
 */
@Service
public class JwtTokenService {

    public static final String TOKEN_TYPE = "Bearer";
    private static final String CLAIM_EMAIL = "email";
    private static final String CLAIM_NAME = "name";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:7200000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    public IssuedToken issueAccessToken(UUID userId, String email, String name) {
        Instant now = clock.instant();
        Instant expiry = now.plusMillis(accessTokenTtlMillis);

        String accessToken = Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_NAME, name)
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedToken(
                accessToken,
                accessTokenTtlMillis / 1000L,
                OffsetDateTime.ofInstant(now, clock.getZone())
        );
    }

    public ParsedToken parseAccessToken(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Missing access token", null);
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            if (claims.getExpiration() == null) {
                throw new InvalidTokenException("Access token has no expiry", null);
            }
            if (claims.getSubject() == null) {
                throw new InvalidTokenException("Access token has no subject", null);
            }
            UUID userId = UUID.fromString(claims.getSubject());
            return new ParsedToken(
                    userId,
                    claims.get(CLAIM_EMAIL, String.class),
                    claims.get(CLAIM_NAME, String.class),
                    OffsetDateTime.ofInstant(claims.getExpiration().toInstant(), clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record IssuedToken(String accessToken, long expiresIn, OffsetDateTime issuedAt) {
    }

    public record ParsedToken(UUID userId, String email, String name, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
