package com.techStack.authCore.service.token;

import com.techStack.authCore.config.TokenProperties;
import com.techStack.authCore.models.SigningKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;

import static com.techStack.authCore.constants.SecurityConstants.MIN_SIGNING_KEY_BYTES;

/**
 * Operator-facing key lifecycle: generating and activating new keys, and revoking retiring keys
 * once no token they signed can still be alive.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KeyRotationService {

    private final KeyRegistry keyRegistry;
    private final TokenProperties tokenProperties;
    private final SecureRandom secureRandom;
    private final Clock clock;

    /**
     * Generates a fresh 512-bit key and makes it active.
     *
     * @return the new active key
     */
    public SigningKey rotate() {
        byte[] secret = new byte[MIN_SIGNING_KEY_BYTES];
        secureRandom.nextBytes(secret);
        byte[] idBytes = new byte[6];
        secureRandom.nextBytes(idBytes);
        Instant now = clock.instant();
        String keyId = "k" + now.getEpochSecond() + "-" + HexFormat.of().formatHex(idBytes);
        return rotate(keyId, secret);
    }

    public SigningKey rotate(String keyId, byte[] secret) {
        SigningKey newKey = SigningKey.active(keyId, secret, clock.instant());
        keyRegistry.rotate(newKey);
        return newKey;
    }

    @Scheduled(fixedDelayString = "${auth.token.key-sweep-interval:PT10M}")
    public void sweepRetiredKeys() {
        Instant cutoff = clock.instant().minus(tokenProperties.getKeyGracePeriod());
        List<SigningKey> revoked = keyRegistry.revokeRetiredBefore(cutoff);
        if (!revoked.isEmpty()) {
            log.info("Key sweep revoked {} retiring key(s) retired before {}", revoked.size(), cutoff);
        }
    }
}
