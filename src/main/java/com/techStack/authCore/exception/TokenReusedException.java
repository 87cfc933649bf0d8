package com.techStack.authCore.exception;

/**
 * A refresh token was presented after it had already been exchanged.
 * By the time this is thrown the whole token chain has been revoked.
 */
public class TokenReusedException extends AuthException {
    public TokenReusedException() {
        super(AuthErrorCode.TOKEN_REUSED, "Refresh token reuse detected. Please log in again.");
    }
}
