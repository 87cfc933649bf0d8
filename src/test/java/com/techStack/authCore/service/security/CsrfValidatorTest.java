package com.techStack.authCore.service.security;

import com.techStack.authCore.config.CsrfProperties;
import com.techStack.authCore.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.security.SecureRandom;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsrfValidatorTest {

    private MutableClock clock;
    private CsrfValidator csrfValidator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        CsrfProperties properties = new CsrfProperties();
        properties.setSecret("unit-test-csrf-secret-0123456789abcdef");
        properties.setTokenTtl(Duration.ofHours(2));
        csrfValidator = new CsrfValidator(properties, new SecureRandom(), clock);
    }

    @Test
    void verify_shouldAcceptTokenForIssuingSession() {
        String token = csrfValidator.issue("session-1");

        assertThat(csrfValidator.verify("session-1", token)).isTrue();
    }

    @Test
    void verify_shouldRejectTokenFromAnotherSession() {
        String token = csrfValidator.issue("session-1");

        assertThat(csrfValidator.verify("session-2", token)).isFalse();
    }

    @Test
    void verify_shouldNotConfuseSessionAndNonceBoundaries() {
        String token = csrfValidator.issue("ab");
        String[] parts = token.split("\\.");
        String shifted = "b" + parts[0] + "." + parts[1] + "." + parts[2];

        assertThat(csrfValidator.verify("a", shifted)).isFalse();
    }

    @Test
    void verify_shouldRejectExpiredToken() {
        String token = csrfValidator.issue("session-1");

        clock.advance(Duration.ofHours(2));

        assertThat(csrfValidator.verify("session-1", token)).isFalse();
    }

    @Test
    void verify_shouldRejectExtendedExpiry() {
        String token = csrfValidator.issue("session-1");
        String[] parts = token.split("\\.");
        long extended = Long.parseLong(parts[1]) + 86_400;

        assertThat(csrfValidator.verify("session-1", parts[0] + "." + extended + "." + parts[2])).isFalse();
    }

    @Test
    void issue_shouldProduceDistinctTokens() {
        assertThat(csrfValidator.issue("session-1")).isNotEqualTo(csrfValidator.issue("session-1"));
    }

    @Test
    void issue_shouldRejectBlankSession() {
        assertThatThrownBy(() -> csrfValidator.issue(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"garbage", "a.b", "a.notanumber.c", ".1.c", "a.1.%%%"})
    void verify_shouldRejectMalformedTokens(String token) {
        assertThat(csrfValidator.verify("session-1", token)).isFalse();
    }

    @Test
    void verify_shouldRequireMatchingCookieAndHeader() {
        String token = csrfValidator.issue("session-1");
        String other = csrfValidator.issue("session-1");

        assertThat(csrfValidator.verify("session-1", token, token)).isTrue();
        assertThat(csrfValidator.verify("session-1", token, other)).isFalse();
        assertThat(csrfValidator.verify("session-1", null, token)).isFalse();
    }
}
