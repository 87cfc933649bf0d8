package com.techStack.authCore.models;

import lombok.Builder;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Set;

/**
 * Claims carried by an access or refresh token.
 * Instants are kept at second precision, the resolution of a JWT NumericDate.
 */
@Builder(toBuilder = true)
public record TokenClaims(
        String subject,
        Set<String> roles,
        Instant issuedAt,
        Instant expiresAt,
        TokenKind kind,
        String jti,
        String keyId,
        String chainId
) {

    public TokenClaims {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(jti, "jti");
        Objects.requireNonNull(chainId, "chainId");
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        issuedAt = issuedAt.truncatedTo(ChronoUnit.SECONDS);
        expiresAt = expiresAt.truncatedTo(ChronoUnit.SECONDS);
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("expiresAt must be after issuedAt");
        }
    }
}
