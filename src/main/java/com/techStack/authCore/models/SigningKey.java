package com.techStack.authCore.models;

import com.techStack.authCore.constants.SecurityConstants;
import io.jsonwebtoken.security.Keys;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import javax.crypto.SecretKey;
import java.time.Instant;
import java.util.Objects;

/**
 * HMAC signing key with lifecycle status. Status changes return a new instance.
 */
@Getter
@EqualsAndHashCode(of = {"keyId", "status"})
public final class SigningKey {

    private final String keyId;
    private final SecretKey secretKey;
    private final Instant createdAt;
    private final KeyStatus status;
    private final Instant retiredAt;

    private SigningKey(String keyId, SecretKey secretKey, Instant createdAt, KeyStatus status, Instant retiredAt) {
        this.keyId = keyId;
        this.secretKey = secretKey;
        this.createdAt = createdAt;
        this.status = status;
        this.retiredAt = retiredAt;
    }

    public static SigningKey active(String keyId, byte[] secret, Instant createdAt) {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("Signing key id must not be blank");
        }
        Objects.requireNonNull(secret, "secret");
        if (secret.length < SecurityConstants.MIN_SIGNING_KEY_BYTES) {
            throw new IllegalArgumentException(String.format(
                    "Signing key %s must be at least 512 bits (64 bytes). Current size: %d bits",
                    keyId, secret.length * 8));
        }
        return new SigningKey(keyId, Keys.hmacShaKeyFor(secret), Objects.requireNonNull(createdAt, "createdAt"),
                KeyStatus.ACTIVE, null);
    }

    public SigningKey retire(Instant at) {
        return new SigningKey(keyId, secretKey, createdAt, KeyStatus.RETIRING, at);
    }

    public SigningKey revoke() {
        return new SigningKey(keyId, secretKey, createdAt, KeyStatus.REVOKED, retiredAt);
    }

    public boolean isActive() {
        return status == KeyStatus.ACTIVE;
    }

    @Override
    public String toString() {
        return "SigningKey{keyId='" + keyId + "', status=" + status + ", createdAt=" + createdAt
                + ", retiredAt=" + retiredAt + "}";
    }
}
