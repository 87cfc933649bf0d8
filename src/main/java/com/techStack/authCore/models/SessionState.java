package com.techStack.authCore.models;

import java.util.EnumSet;
import java.util.Set;

/**
 * Externally visible lifecycle of an authentication session.
 */
public enum SessionState {
    ANONYMOUS,
    AUTHENTICATING,
    AUTHENTICATED,
    REFRESHING,
    REVOKED;

    public Set<SessionState> successors() {
        return switch (this) {
            case ANONYMOUS -> EnumSet.of(AUTHENTICATING);
            case AUTHENTICATING -> EnumSet.of(AUTHENTICATED, ANONYMOUS);
            case AUTHENTICATED -> EnumSet.of(REFRESHING, REVOKED);
            case REFRESHING -> EnumSet.of(AUTHENTICATED, REVOKED);
            case REVOKED -> EnumSet.noneOf(SessionState.class);
        };
    }

    public boolean canTransitionTo(SessionState next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return this == REVOKED;
    }
}
