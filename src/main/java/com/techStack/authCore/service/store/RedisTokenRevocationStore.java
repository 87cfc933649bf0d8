package com.techStack.authCore.service.store;

import com.techStack.authCore.repository.TokenRevocationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static com.techStack.authCore.constants.SecurityConstants.REVOKED_CHAIN_PREFIX;
import static com.techStack.authCore.constants.SecurityConstants.SPENT_JTI_PREFIX;

@Slf4j
@Component
@ConditionalOnProperty(name = "auth.store.type", havingValue = "redis")
public class RedisTokenRevocationStore implements TokenRevocationStore {

    private static final String MARKER = "1";

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;

    public RedisTokenRevocationStore(@Qualifier("authStoreRedisTemplate") StringRedisTemplate redisTemplate,
                                     Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
    }

    @Override
    public boolean markSpent(String jti, Instant until) {
        Boolean stored = redisTemplate.opsForValue()
                .setIfAbsent(SPENT_JTI_PREFIX + jti, MARKER, ttlUntil(until));
        return Boolean.TRUE.equals(stored);
    }

    @Override
    public boolean isSpent(String jti) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(SPENT_JTI_PREFIX + jti));
    }

    @Override
    public void revokeChain(String chainId, Instant until) {
        redisTemplate.opsForValue().set(REVOKED_CHAIN_PREFIX + chainId, MARKER, ttlUntil(until));
        log.debug("Chain {} revoked in Redis until {}", chainId, until);
    }

    @Override
    public boolean isChainRevoked(String chainId) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(REVOKED_CHAIN_PREFIX + chainId));
    }

    private Duration ttlUntil(Instant until) {
        Duration ttl = Duration.between(clock.instant(), until);
        return ttl.isNegative() || ttl.isZero() ? Duration.ofSeconds(1) : ttl;
    }
}
