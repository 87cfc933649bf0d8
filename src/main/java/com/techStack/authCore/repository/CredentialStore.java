package com.techStack.authCore.repository;

import com.techStack.authCore.models.Principal;
import reactor.core.publisher.Mono;

/**
 * Narrow view of the user directory. Lookups and hash comparisons may block on I/O,
 * so both are exposed as {@link Mono}.
 */
public interface CredentialStore {

    /**
     * @return the principal, or an empty Mono when the identity is unknown
     */
    Mono<Principal> findByIdentity(String identity);

    /**
     * Delegates to the password hasher. Never implemented by this core.
     */
    Mono<Boolean> compareSecret(String passwordHash, String candidate);

    /**
     * A well-formed hash that matches no real secret. Unknown identities are compared against it
     * so that they cost the same as known ones.
     */
    String decoyHash();
}
