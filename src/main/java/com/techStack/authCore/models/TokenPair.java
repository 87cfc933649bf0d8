package com.techStack.authCore.models;

import com.techStack.authCore.constants.SecurityConstants;

import java.time.Instant;

public record TokenPair(
        String accessToken,
        String refreshToken,
        Instant accessTokenExpiresAt,
        Instant refreshTokenExpiresAt,
        String chainId
) {

    public String tokenType() {
        return SecurityConstants.TOKEN_TYPE;
    }

    @Override
    public String toString() {
        return "TokenPair{chainId='" + chainId + "', accessTokenExpiresAt=" + accessTokenExpiresAt
                + ", refreshTokenExpiresAt=" + refreshTokenExpiresAt + "}";
    }
}
