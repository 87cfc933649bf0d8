package com.techStack.authCore.models;

import lombok.Getter;

/**
 * Independent failure tracks. The identity track slows attackers rotating source addresses,
 * the IP track slows credential stuffing across many identities from one address.
 */
@Getter
public enum LockoutTrack {
    IDENTITY("lockout-identity"),
    IP("lockout-ip");

    private final String scope;

    LockoutTrack(String scope) {
        this.scope = scope;
    }
}
