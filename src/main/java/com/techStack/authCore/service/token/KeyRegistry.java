package com.techStack.authCore.service.token;

import com.techStack.authCore.exception.KeyUnavailableException;
import com.techStack.authCore.models.KeyStatus;
import com.techStack.authCore.models.SigningKey;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static com.techStack.authCore.constants.SecurityConstants.SECURITY_MARKER;

/**
 * Holds the active signing key plus the retiring keys that are still accepted for verification.
 * <p>
 * Readers see an immutable snapshot through a volatile reference and never lock. Writers are
 * serialized and publish a new snapshot in one step, so there is always exactly one active key.
 * Scheduling of the retiring-key sweep belongs to {@link KeyRotationService}.
 */
@Slf4j
public class KeyRegistry {

    private final AtomicReference<KeyRing> ring;
    private final Clock clock;

    public KeyRegistry(SigningKey activeKey, List<SigningKey> retiringKeys, Clock clock) {
        if (activeKey == null || !activeKey.isActive()) {
            throw new KeyUnavailableException("Key registry requires exactly one active signing key");
        }
        List<SigningKey> retiring = retiringKeys == null ? List.of() : List.copyOf(retiringKeys);
        retiring.forEach(key -> {
            if (key.getStatus() != KeyStatus.RETIRING) {
                throw new IllegalArgumentException("Key " + key.getKeyId() + " is not retiring");
            }
        });
        KeyRing initial = new KeyRing(activeKey, retiring, List.of());
        initial.assertUniqueIds();

        this.ring = new AtomicReference<>(initial);
        this.clock = clock;
        log.info("Key registry initialised with active key {} and {} retiring key(s)",
                activeKey.getKeyId(), retiring.size());
    }

    public SigningKey active() {
        return ring.get().active();
    }

    /**
     * @return the active key followed by retiring keys, most recently retired first
     */
    public List<SigningKey> verifiable() {
        KeyRing current = ring.get();
        List<SigningKey> keys = new ArrayList<>(current.retiring().size() + 1);
        keys.add(current.active());
        keys.addAll(current.retiring());
        return List.copyOf(keys);
    }

    public Optional<SigningKey> find(String keyId) {
        return ring.get().stream()
                .filter(key -> key.getKeyId().equals(keyId))
                .findFirst();
    }

    public List<SigningKey> all() {
        return ring.get().stream().toList();
    }

    /**
     * Makes {@code newKey} active and moves the current active key to retiring.
     *
     * @return the key that is now retiring
     */
    public synchronized SigningKey rotate(SigningKey newKey) {
        if (newKey == null || !newKey.isActive()) {
            throw new IllegalArgumentException("Rotation requires a key in ACTIVE status");
        }
        KeyRing current = ring.get();
        if (current.stream().anyMatch(key -> key.getKeyId().equals(newKey.getKeyId()))) {
            throw new IllegalArgumentException("Key id " + newKey.getKeyId() + " has already been used");
        }

        SigningKey retired = current.active().retire(clock.instant());
        List<SigningKey> retiring = new ArrayList<>(current.retiring().size() + 1);
        retiring.add(retired);
        retiring.addAll(current.retiring());
        ring.set(new KeyRing(newKey, List.copyOf(retiring), current.revoked()));

        log.info(SECURITY_MARKER, "Signing key rotated: {} is active, {} is retiring",
                newKey.getKeyId(), retired.getKeyId());
        return retired;
    }

    /**
     * Revokes a retiring key. The active key can only leave through {@link #rotate(SigningKey)}.
     */
    public synchronized void revoke(String keyId) {
        KeyRing current = ring.get();
        if (current.active().getKeyId().equals(keyId)) {
            throw new IllegalStateException("The active key cannot be revoked; rotate first");
        }
        SigningKey target = current.retiring().stream()
                .filter(key -> key.getKeyId().equals(keyId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No retiring key with id " + keyId));

        ring.set(current.withRevoked(List.of(target)));
        log.warn(SECURITY_MARKER, "Signing key {} revoked", keyId);
    }

    /**
     * Revokes every retiring key that was retired at or before {@code cutoff}.
     *
     * @return the keys revoked by this call
     */
    public synchronized List<SigningKey> revokeRetiredBefore(Instant cutoff) {
        KeyRing current = ring.get();
        List<SigningKey> expired = current.retiring().stream()
                .filter(key -> key.getRetiredAt() != null && !key.getRetiredAt().isAfter(cutoff))
                .toList();
        if (!expired.isEmpty()) {
            ring.set(current.withRevoked(expired));
            expired.forEach(key -> log.info(SECURITY_MARKER,
                    "Signing key {} revoked after its grace period (retired at {})",
                    key.getKeyId(), key.getRetiredAt()));
        }
        return expired;
    }

    private record KeyRing(SigningKey active, List<SigningKey> retiring, List<SigningKey> revoked) {

        Stream<SigningKey> stream() {
            return Stream.of(Stream.of(active), retiring.stream(), revoked.stream()).flatMap(s -> s);
        }

        KeyRing withRevoked(List<SigningKey> toRevoke) {
            List<String> ids = toRevoke.stream().map(SigningKey::getKeyId).toList();
            List<SigningKey> remaining = retiring.stream()
                    .filter(key -> !ids.contains(key.getKeyId()))
                    .toList();
            List<SigningKey> newlyRevoked = new ArrayList<>(revoked);
            toRevoke.forEach(key -> newlyRevoked.add(key.revoke()));
            return new KeyRing(active, remaining, List.copyOf(newlyRevoked));
        }

        void assertUniqueIds() {
            long distinct = stream().map(SigningKey::getKeyId).distinct().count();
            if (distinct != stream().count()) {
                throw new IllegalArgumentException("Signing key ids must be unique");
            }
        }
    }
}
