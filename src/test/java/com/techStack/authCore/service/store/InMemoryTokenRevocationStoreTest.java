package com.techStack.authCore.service.store;

import com.techStack.authCore.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryTokenRevocationStoreTest {

    private MutableClock clock;
    private InMemoryTokenRevocationStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        store = new InMemoryTokenRevocationStore(clock);
    }

    @Test
    void markSpent_shouldSucceedOnlyOnce_whileRetained() {
        Instant until = clock.instant().plus(Duration.ofHours(1));

        assertThat(store.markSpent("jti-1", until)).isTrue();
        assertThat(store.markSpent("jti-1", until)).isFalse();
        assertThat(store.isSpent("jti-1")).isTrue();
        assertThat(store.isSpent("jti-2")).isFalse();
    }

    @Test
    void markSpent_shouldForget_afterRetention() {
        store.markSpent("jti-1", clock.instant().plus(Duration.ofMinutes(1)));

        clock.advance(Duration.ofMinutes(1));

        assertThat(store.isSpent("jti-1")).isFalse();
        assertThat(store.markSpent("jti-1", clock.instant().plus(Duration.ofMinutes(1)))).isTrue();
    }

    @Test
    void revokeChain_shouldKeepLaterHorizon() {
        Instant later = clock.instant().plus(Duration.ofDays(7));
        store.revokeChain("chain-1", later);
        store.revokeChain("chain-1", clock.instant().plus(Duration.ofMinutes(1)));

        clock.advance(Duration.ofDays(1));

        assertThat(store.isChainRevoked("chain-1")).isTrue();
        assertThat(store.isChainRevoked("chain-2")).isFalse();
    }

    @Test
    void purgeExpired_shouldDropLapsedEntries() {
        store.markSpent("jti-1", clock.instant().plus(Duration.ofMinutes(1)));
        store.revokeChain("chain-1", clock.instant().plus(Duration.ofMinutes(1)));

        clock.advance(Duration.ofMinutes(2));
        store.purgeExpired();

        assertThat(store.isSpent("jti-1")).isFalse();
        assertThat(store.isChainRevoked("chain-1")).isFalse();
    }
}
