package com.techStack.authCore.config;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "auth.login")
public class LoginProperties {

    /**
     * Upper bound for a login or refresh, credential store round trips included.
     */
    @NotNull
    private Duration timeout = Duration.ofSeconds(5);

    /**
     * Failed logins are not answered before this much time has passed since the request arrived.
     */
    @NotNull
    private Duration minimumFailureDuration = Duration.ofMillis(250);
}
