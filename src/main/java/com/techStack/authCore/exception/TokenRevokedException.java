package com.techStack.authCore.exception;

public class TokenRevokedException extends AuthException {
    public TokenRevokedException() {
        super(AuthErrorCode.TOKEN_REVOKED, "Session has been revoked. Please log in again.");
    }
}
