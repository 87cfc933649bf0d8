package com.techStack.authCore.models;

public enum KeyStatus {
    ACTIVE,
    RETIRING,
    REVOKED;

    public boolean isVerifiable() {
        return this != REVOKED;
    }
}
