package com.techStack.authCore.exception;

public class MalformedTokenException extends AuthException {
    public MalformedTokenException(String message) {
        super(AuthErrorCode.MALFORMED_TOKEN, message);
    }

    public MalformedTokenException(String message, Throwable cause) {
        super(AuthErrorCode.MALFORMED_TOKEN, message, cause);
    }
}
