package com.techStack.authCore.exception;

import lombok.Getter;

/**
 * Error codes surfaced by the authentication core.
 * The HTTP status is a hint for the transport layer sitting in front of it.
 */
@Getter
public enum AuthErrorCode {

    INVALID_CREDENTIALS("AUTH_001", 401),
    ACCOUNT_LOCKED("AUTH_002", 423),
    TOO_MANY_REQUESTS("AUTH_003", 429),
    TOKEN_EXPIRED("AUTH_004", 401),
    INVALID_SIGNATURE("AUTH_005", 401),
    TOKEN_REUSED("AUTH_006", 401),
    MALFORMED_TOKEN("AUTH_007", 400),
    KEY_UNAVAILABLE("AUTH_008", 503),
    TOKEN_REVOKED("AUTH_009", 401),
    SERVICE_UNAVAILABLE("AUTH_010", 503);

    private final String code;
    private final int httpStatus;

    AuthErrorCode(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }
}
