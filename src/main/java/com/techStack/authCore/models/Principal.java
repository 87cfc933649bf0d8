package com.techStack.authCore.models;

import lombok.Builder;

import java.util.Set;

/**
 * Identity as known to the credential store. The password hash is opaque to this core.
 */
@Builder
public record Principal(
        String id,
        String identity,
        String passwordHash,
        Set<String> roles
) {

    public Principal {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    @Override
    public String toString() {
        return "Principal{id='" + id + "', identity='" + identity + "', roles=" + roles + "}";
    }
}
