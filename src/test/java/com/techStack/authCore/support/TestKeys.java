package com.techStack.authCore.support;

import com.techStack.authCore.config.TokenProperties;
import com.techStack.authCore.models.SigningKey;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

public final class TestKeys {

    public static final String ISSUER = "techStack-auth-test";

    private TestKeys() {}

    public static byte[] secret(char fill) {
        byte[] secret = new byte[64];
        Arrays.fill(secret, (byte) fill);
        return secret;
    }

    public static SigningKey activeKey(String keyId, char fill, Instant createdAt) {
        return SigningKey.active(keyId, secret(fill), createdAt);
    }

    public static TokenProperties tokenProperties() {
        TokenProperties properties = new TokenProperties();
        properties.setIssuer(ISSUER);
        properties.setAccessTokenTtl(Duration.ofMinutes(15));
        properties.setRefreshTokenTtl(Duration.ofDays(7));
        properties.setClockSkew(Duration.ofSeconds(30));
        properties.setKeyGracePeriod(Duration.ofDays(8));
        return properties;
    }
}
