package com.techStack.authCore.repository;

import java.time.Instant;

/**
 * Records spent refresh-token ids and revoked token chains until they can no longer matter.
 */
public interface TokenRevocationStore {

    /**
     * Atomically marks the jti as spent.
     *
     * @return true if this call spent it, false if it had already been spent
     */
    boolean markSpent(String jti, Instant until);

    boolean isSpent(String jti);

    void revokeChain(String chainId, Instant until);

    boolean isChainRevoked(String chainId);
}
