package com.techStack.authCore.service.security;

import com.techStack.authCore.config.RateLimitProperties;
import com.techStack.authCore.exception.RateLimitExceededException;
import com.techStack.authCore.models.CounterState;
import com.techStack.authCore.models.RateLimitDecision;
import com.techStack.authCore.repository.CounterStore;
import com.techStack.authCore.service.observability.AuthMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sliding-window rate limiter over a {@link CounterStore}. Each key is updated through
 * compare-and-set, so concurrent callers on one key never lose a hit and callers on different keys
 * never wait for each other. Rejected requests are not counted. Nothing here sleeps.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimiter {

    private final CounterStore counterStore;
    private final RateLimitProperties rateLimitProperties;
    private final AuthMetrics authMetrics;
    private final Clock clock;

    public RateLimitDecision allow(String key, int limit, Duration window) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        long windowMillis = window.toMillis();
        AtomicReference<RateLimitDecision> decision = new AtomicReference<>();

        counterStore.update(key, current -> {
            long now = clock.millis();
            CounterState rolled = SlidingWindow.roll(current, now, windowMillis);
            double effective = SlidingWindow.effectiveCount(rolled, now, windowMillis);
            if (effective + 1 > limit) {
                long resetAt = SlidingWindow.nextAvailableAt(rolled, now, windowMillis, limit);
                decision.set(RateLimitDecision.rejected(Instant.ofEpochMilli(resetAt)));
                return current;
            }
            long remaining = (long) Math.floor(limit - effective - 1);
            decision.set(RateLimitDecision.allowed(remaining,
                    Instant.ofEpochMilli(rolled.windowStart() + windowMillis)));
            return SlidingWindow.hit(rolled, now);
        }, state -> window.multipliedBy(2));

        return decision.get();
    }

    public RateLimitDecision allow(String scope, String subject) {
        RateLimitProperties.Quota quota = rateLimitProperties.quotaFor(scope);
        return allow(scope + ":" + subject, quota.getLimit(), quota.getWindow());
    }

    /**
     * @throws RateLimitExceededException carrying the earliest retry instant when the quota is spent
     */
    public void acquire(String scope, String subject) {
        RateLimitDecision decision = allow(scope, subject);
        if (!decision.allowed()) {
            log.warn("Rate limit exceeded for scope {} (retry at {})", scope, decision.resetAt());
            authMetrics.rateLimited(scope);
            throw new RateLimitExceededException(scope, decision.resetAt());
        }
    }
}
