package com.techStack.authCore.service.store;

import com.techStack.authCore.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static com.techStack.authCore.constants.SecurityConstants.REVOKED_CHAIN_PREFIX;
import static com.techStack.authCore.constants.SecurityConstants.SPENT_JTI_PREFIX;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisTokenRevocationStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private MutableClock clock;
    private RedisTokenRevocationStore store;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        store = new RedisTokenRevocationStore(redisTemplate, clock);
    }

    @Test
    void markSpent_shouldUseSetIfAbsentWithRemainingTtl() {
        when(valueOperations.setIfAbsent(SPENT_JTI_PREFIX + "jti-1", "1", Duration.ofHours(1))).thenReturn(true);

        assertThat(store.markSpent("jti-1", clock.instant().plus(Duration.ofHours(1)))).isTrue();
    }

    @Test
    void markSpent_shouldReportAlreadySpent() {
        when(valueOperations.setIfAbsent(SPENT_JTI_PREFIX + "jti-1", "1", Duration.ofHours(1))).thenReturn(false);

        assertThat(store.markSpent("jti-1", clock.instant().plus(Duration.ofHours(1)))).isFalse();
    }

    @Test
    void revokeChain_shouldClampPastHorizonToOneSecond() {
        store.revokeChain("chain-1", clock.instant().minusSeconds(5));

        verify(valueOperations).set(REVOKED_CHAIN_PREFIX + "chain-1", "1", Duration.ofSeconds(1));
    }

    @Test
    void isChainRevoked_shouldCheckKeyPresence() {
        when(redisTemplate.hasKey(REVOKED_CHAIN_PREFIX + "chain-1")).thenReturn(true);

        assertThat(store.isChainRevoked("chain-1")).isTrue();
        assertThat(store.isChainRevoked("chain-2")).isFalse();
    }
}
