package com.techStack.authCore.exception;

import java.time.Instant;

public class AccountLockedException extends AuthException {

    public AccountLockedException(Instant lockedUntil) {
        super(AuthErrorCode.ACCOUNT_LOCKED,
                "Too many failed attempts. Try again later.", lockedUntil, null);
    }

    public Instant getLockedUntil() {
        return getRetryAfter();
    }
}
