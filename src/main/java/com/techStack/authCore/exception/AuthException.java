package com.techStack.authCore.exception;

import lombok.Getter;

import java.time.Instant;

/**
 * Base type for every failure the authentication core reports to its callers.
 * Messages stay generic. Diagnostic detail goes to the log.
 */
@Getter
public class AuthException extends RuntimeException {

    private final AuthErrorCode errorCode;
    private final Instant retryAfter;

    public AuthException(AuthErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public AuthException(AuthErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    public AuthException(AuthErrorCode errorCode, String message, Instant retryAfter, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryAfter = retryAfter;
    }

    public int getHttpStatus() {
        return errorCode.getHttpStatus();
    }

    @Override
    public String toString() {
        return String.format(
                "%s{errorCode=%s, message=%s, retryAfter=%s}",
                getClass().getSimpleName(), errorCode.getCode(), getMessage(), retryAfter
        );
    }
}
