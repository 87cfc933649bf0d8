package com.techStack.authCore.exception;

import lombok.Getter;

import java.time.Instant;

@Getter
public class RateLimitExceededException extends AuthException {

    private final String scope;

    public RateLimitExceededException(String scope, Instant resetAt) {
        super(AuthErrorCode.TOO_MANY_REQUESTS, "Too many requests. Please try again later.", resetAt, null);
        this.scope = scope;
    }

    public Instant getResetAt() {
        return getRetryAfter();
    }
}
