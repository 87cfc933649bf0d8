package com.techStack.authCore.exception;

public class InvalidSignatureException extends AuthException {
    public InvalidSignatureException() {
        super(AuthErrorCode.INVALID_SIGNATURE, "Invalid token signature");
    }
}
