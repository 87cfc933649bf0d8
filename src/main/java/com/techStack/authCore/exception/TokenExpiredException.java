package com.techStack.authCore.exception;

public class TokenExpiredException extends AuthException {
    public TokenExpiredException(Throwable cause) {
        super(AuthErrorCode.TOKEN_EXPIRED, "Token expired", cause);
    }
}
