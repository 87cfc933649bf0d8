package com.techStack.authCore.config;

import com.techStack.authCore.constants.SecurityConstants;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "auth.rate-limit")
public class RateLimitProperties {

    @Valid
    private Map<String, Quota> quotas = defaultQuotas();

    public Quota quotaFor(String scope) {
        Quota quota = quotas.get(scope);
        if (quota == null) {
            throw new IllegalArgumentException("No rate limit quota configured for scope " + scope);
        }
        return quota;
    }

    private static Map<String, Quota> defaultQuotas() {
        Map<String, Quota> defaults = new HashMap<>();
        defaults.put(SecurityConstants.SCOPE_LOGIN_IP, new Quota(30, Duration.ofMinutes(1)));
        defaults.put(SecurityConstants.SCOPE_LOGIN_IDENTITY, new Quota(10, Duration.ofMinutes(1)));
        defaults.put(SecurityConstants.SCOPE_REFRESH, new Quota(30, Duration.ofMinutes(1)));
        return defaults;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Quota {
        @Positive
        private int limit;

        @NotNull
        private Duration window;
    }
}
