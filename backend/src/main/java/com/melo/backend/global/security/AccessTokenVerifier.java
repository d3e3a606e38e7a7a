package com.melo.backend.global.security;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.List;
import java.util.Objects;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.springframework.stereotype.Service;

/**
 * Verifies bearer tokens minted by the session layer. The subject is the caller's Matrix user id
 * ({@code @alice:example.org}); this service never issues tokens.
 */
@Service
public class AccessTokenVerifier {

    private final JwtSecretKeyProvider keyProvider;
    private final Clock clock;

    public AccessTokenVerifier(JwtSecretKeyProvider keyProvider, Clock clock) {
        this.keyProvider = keyProvider;
        this.clock = clock;
    }

    public VerifiedToken verify(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(keyProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String userId = claims.getSubject();
            if (userId == null || !userId.startsWith("@") || !userId.contains(":")) {
                throw new InvalidTokenException("Token subject is not a Matrix user id", null);
            }
            List<?> rolesClaim = claims.get("roles", List.class);
            List<String> roles = rolesClaim == null ? List.of() : rolesClaim.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList();
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new VerifiedToken(
                    userId,
                    roles,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record VerifiedToken(String userId, List<String> roles, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
