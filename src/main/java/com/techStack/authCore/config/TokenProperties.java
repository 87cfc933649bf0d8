package com.techStack.authCore.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "auth.token")
@Getter
@Setter
public class TokenProperties {

    @NotBlank(message = "auth.token.issuer must not be blank")
    private String issuer = "techStack-auth";

    @NotNull
    private Duration accessTokenTtl = Duration.ofMinutes(15);

    @NotNull
    private Duration refreshTokenTtl = Duration.ofDays(7);

    @NotNull
    private Duration clockSkew = Duration.ofSeconds(30);

    /**
     * How long a retiring key stays verifiable before the sweep revokes it.
     */
    @NotNull
    private Duration keyGracePeriod = Duration.ofDays(8);

    @NotNull
    private Duration keySweepInterval = Duration.ofMinutes(10);

    /**
     * Key id to sign with. When unset the last configured key is active.
     */
    private String activeKeyId;

    @Valid
    @NotEmpty(message = "auth.token.signing-keys must contain at least one key")
    private List<SigningKeyDefinition> signingKeys = new ArrayList<>();

    @AssertTrue(message = "auth.token.refresh-token-ttl must not be shorter than auth.token.access-token-ttl")
    public boolean isRefreshOutlivingAccess() {
        return accessTokenTtl == null || refreshTokenTtl == null
                || refreshTokenTtl.compareTo(accessTokenTtl) >= 0;
    }

    @AssertTrue(message = "auth.token.key-grace-period must cover the refresh token lifetime plus clock skew")
    public boolean isGracePeriodCoveringRefreshTokens() {
        return keyGracePeriod == null || refreshTokenTtl == null || clockSkew == null
                || keyGracePeriod.compareTo(refreshTokenTtl.plus(clockSkew)) >= 0;
    }

    @Getter
    @Setter
    public static class SigningKeyDefinition {

        @NotBlank
        private String id;

        /**
         * Base64 encoded, or raw UTF-8 when not valid Base64. At least 64 bytes.
         */
        @NotBlank
        private String secret;
    }
}
