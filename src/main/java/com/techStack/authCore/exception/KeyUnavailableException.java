package com.techStack.authCore.exception;

public class KeyUnavailableException extends AuthException {
    public KeyUnavailableException(String message) {
        super(AuthErrorCode.KEY_UNAVAILABLE, message);
    }
}
