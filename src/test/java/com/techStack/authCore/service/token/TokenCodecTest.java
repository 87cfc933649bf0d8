package com.techStack.authCore.service.token;

import com.techStack.authCore.exception.InvalidSignatureException;
import com.techStack.authCore.exception.KeyUnavailableException;
import com.techStack.authCore.exception.MalformedTokenException;
import com.techStack.authCore.exception.TokenExpiredException;
import com.techStack.authCore.models.SigningKey;
import com.techStack.authCore.models.TokenClaims;
import com.techStack.authCore.models.TokenKind;
import com.techStack.authCore.support.MutableClock;
import com.techStack.authCore.support.TestKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenCodecTest {

    private MutableClock clock;
    private TokenCodec tokenCodec;
    private SigningKey keyA;
    private SigningKey keyB;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        tokenCodec = new TokenCodec(TestKeys.tokenProperties(), clock);
        keyA = TestKeys.activeKey("k-a", 'a', clock.instant());
        keyB = TestKeys.activeKey("k-b", 'b', clock.instant());
    }

    private TokenClaims claims(TokenKind kind) {
        Instant now = clock.instant();
        return TokenClaims.builder()
                .subject("user-1")
                .roles(Set.of("USER", "ADMIN"))
                .issuedAt(now)
                .expiresAt(now.plus(Duration.ofMinutes(15)))
                .kind(kind)
                .jti("jti-1")
                .chainId("chain-1")
                .build();
    }

    @Test
    void verify_shouldReturnIssuedClaims_whenSignedWithCandidateKey() {
        String token = tokenCodec.issue(claims(TokenKind.ACCESS), keyA);

        TokenClaims verified = tokenCodec.verify(token, List.of(keyA));

        assertThat(verified.subject()).isEqualTo("user-1");
        assertThat(verified.roles()).containsExactlyInAnyOrder("USER", "ADMIN");
        assertThat(verified.kind()).isEqualTo(TokenKind.ACCESS);
        assertThat(verified.jti()).isEqualTo("jti-1");
        assertThat(verified.chainId()).isEqualTo("chain-1");
        assertThat(verified.keyId()).isEqualTo("k-a");
        assertThat(verified.issuedAt()).isEqualTo(clock.instant());
        assertThat(verified.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(15)));
    }

    @Test
    void verify_shouldAcceptRetiringKey_whenActiveKeyDoesNotMatch() {
        String token = tokenCodec.issue(claims(TokenKind.ACCESS), keyA);
        SigningKey retiringA = keyA.retire(clock.instant());

        TokenClaims verified = tokenCodec.verify(token, List.of(keyB, retiringA));

        assertThat(verified.keyId()).isEqualTo("k-a");
    }

    @Test
    void verify_shouldThrowInvalidSignature_whenNoCandidateMatches() {
        String token = tokenCodec.issue(claims(TokenKind.ACCESS), keyA);

        assertThatThrownBy(() -> tokenCodec.verify(token, List.of(keyB)))
                .isInstanceOf(InvalidSignatureException.class);
    }

    @Test
    void verify_shouldThrowInvalidSignature_whenSignatureSegmentTampered() {
        String token = tokenCodec.issue(claims(TokenKind.ACCESS), keyA);
        int lastDot = token.lastIndexOf('.');
        char first = token.charAt(lastDot + 1);
        String tampered = token.substring(0, lastDot + 1) + (first == 'A' ? 'B' : 'A') + token.substring(lastDot + 2);

        assertThatThrownBy(() -> tokenCodec.verify(tampered, List.of(keyA)))
                .isInstanceOf(InvalidSignatureException.class);
    }

    @Test
    void verify_shouldIgnoreRevokedKeys() {
        String token = tokenCodec.issue(claims(TokenKind.ACCESS), keyA);

        assertThatThrownBy(() -> tokenCodec.verify(token, List.of(keyB, keyA.revoke())))
                .isInstanceOf(InvalidSignatureException.class);
    }

    @Test
    void verify_shouldThrowKeyUnavailable_whenNoVerifiableKeyIsGiven() {
        String token = tokenCodec.issue(claims(TokenKind.ACCESS), keyA);

        assertThatThrownBy(() -> tokenCodec.verify(token, List.of(keyA.revoke())))
                .isInstanceOf(KeyUnavailableException.class);
        assertThatThrownBy(() -> tokenCodec.verify(token, List.of()))
                .isInstanceOf(KeyUnavailableException.class);
    }

    @Test
    void verify_shouldThrowTokenExpired_whenPastExpiryPlusSkew() {
        String token = tokenCodec.issue(claims(TokenKind.ACCESS), keyA);
        clock.advance(Duration.ofMinutes(15).plusSeconds(31));

        assertThatThrownBy(() -> tokenCodec.verify(token, List.of(keyA)))
                .isInstanceOf(TokenExpiredException.class);
    }

    @Test
    void verify_shouldAccept_whenExpiredWithinClockSkew() {
        String token = tokenCodec.issue(claims(TokenKind.ACCESS), keyA);
        clock.advance(Duration.ofMinutes(15).plusSeconds(10));

        assertThat(tokenCodec.verify(token, List.of(keyA)).jti()).isEqualTo("jti-1");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "not-a-token", "a.b", "a.b.c.d", "###.###.###"})
    void verify_shouldThrowMalformed_whenTokenIsNotCompactJws(String token) {
        assertThatThrownBy(() -> tokenCodec.verify(token, List.of(keyA)))
                .isInstanceOf(MalformedTokenException.class);
    }

    @Test
    void verify_shouldRejectWrongKind() {
        String refresh = tokenCodec.issue(claims(TokenKind.REFRESH), keyA);

        assertThatThrownBy(() -> tokenCodec.verify(refresh, List.of(keyA), TokenKind.ACCESS))
                .isInstanceOf(MalformedTokenException.class);
        assertThat(tokenCodec.verify(refresh, List.of(keyA), TokenKind.REFRESH).kind())
                .isEqualTo(TokenKind.REFRESH);
    }

    @Test
    void issue_shouldRefuseRevokedKey() {
        assertThatThrownBy(() -> tokenCodec.issue(claims(TokenKind.ACCESS), keyA.revoke()))
                .isInstanceOf(KeyUnavailableException.class);
        assertThatThrownBy(() -> tokenCodec.issue(claims(TokenKind.ACCESS), null))
                .isInstanceOf(KeyUnavailableException.class);
    }

    @Test
    void issue_shouldProduceThreeSegments() {
        String token = tokenCodec.issue(claims(TokenKind.ACCESS), keyA);

        assertThat(token.split("\\.")).hasSize(3);
    }
}
