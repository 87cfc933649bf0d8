package com.techStack.authCore.service.token;

import com.techStack.authCore.config.TokenProperties;
import com.techStack.authCore.exception.InvalidSignatureException;
import com.techStack.authCore.models.KeyStatus;
import com.techStack.authCore.models.SigningKey;
import com.techStack.authCore.models.TokenClaims;
import com.techStack.authCore.models.TokenKind;
import com.techStack.authCore.support.MutableClock;
import com.techStack.authCore.support.TestKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyRotationServiceTest {

    private MutableClock clock;
    private TokenProperties tokenProperties;
    private KeyRegistry keyRegistry;
    private KeyRotationService rotationService;
    private TokenCodec tokenCodec;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        tokenProperties = TestKeys.tokenProperties();
        keyRegistry = new KeyRegistry(TestKeys.activeKey("k-1", 'a', clock.instant()), List.of(), clock);
        rotationService = new KeyRotationService(keyRegistry, tokenProperties, new SecureRandom(), clock);
        tokenCodec = new TokenCodec(tokenProperties, clock);
    }

    private String refreshTokenSignedNow() {
        return tokenCodec.issue(TokenClaims.builder()
                .subject("user-1")
                .issuedAt(clock.instant())
                .expiresAt(clock.instant().plus(tokenProperties.getRefreshTokenTtl()))
                .kind(TokenKind.REFRESH)
                .jti("jti-1")
                .chainId("chain-1")
                .build(), keyRegistry.active());
    }

    @Test
    void rotate_shouldGenerateFreshActiveKey() {
        SigningKey generated = rotationService.rotate();

        assertThat(generated.isActive()).isTrue();
        assertThat(generated.getKeyId()).startsWith("k" + clock.instant().getEpochSecond() + "-");
        assertThat(keyRegistry.active()).isEqualTo(generated);
        assertThat(keyRegistry.find("k-1")).get()
                .extracting(SigningKey::getStatus).isEqualTo(KeyStatus.RETIRING);
    }

    @Test
    void rotate_shouldKeepOldTokensVerifiable_untilGracePeriodEnds() {
        String token = refreshTokenSignedNow();
        rotationService.rotate();

        clock.advance(Duration.ofDays(7));
        rotationService.sweepRetiredKeys();
        assertThat(tokenCodec.verify(token, keyRegistry.verifiable()).keyId()).isEqualTo("k-1");

        clock.advance(Duration.ofDays(1).plusSeconds(1));
        rotationService.sweepRetiredKeys();
        assertThat(keyRegistry.find("k-1")).get()
                .extracting(SigningKey::getStatus).isEqualTo(KeyStatus.REVOKED);
        assertThatThrownBy(() -> tokenCodec.verify(token, keyRegistry.verifiable()))
                .isInstanceOf(InvalidSignatureException.class);
    }

    @Test
    void rotate_shouldRejectShortSecret() {
        assertThatThrownBy(() -> rotationService.rotate("k-short", new byte[32]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(keyRegistry.active().getKeyId()).isEqualTo("k-1");
    }
}
