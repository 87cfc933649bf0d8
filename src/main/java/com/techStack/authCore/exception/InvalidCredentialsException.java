package com.techStack.authCore.exception;

/**
 * Raised for every failed credential check. It never says whether the identity exists.
 */
public class InvalidCredentialsException extends AuthException {
    public InvalidCredentialsException() {
        super(AuthErrorCode.INVALID_CREDENTIALS, "Invalid credentials");
    }
}
