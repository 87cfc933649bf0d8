package com.techStack.authCore.models;

import java.time.Instant;

public record RateLimitDecision(boolean allowed, long remaining, Instant resetAt) {

    public static RateLimitDecision allowed(long remaining, Instant resetAt) {
        return new RateLimitDecision(true, remaining, resetAt);
    }

    public static RateLimitDecision rejected(Instant resetAt) {
        return new RateLimitDecision(false, 0, resetAt);
    }
}
