package com.techStack.authCore.exception;

/**
 * The credential backend failed or timed out. Authentication fails closed.
 */
public class AuthServiceUnavailableException extends AuthException {
    public AuthServiceUnavailableException(Throwable cause) {
        super(AuthErrorCode.SERVICE_UNAVAILABLE, "Authentication is temporarily unavailable", cause);
    }
}
