package com.techStack.authCore.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "auth.csrf")
public class CsrfProperties {

    @NotNull(message = "auth.csrf.secret must be set")
    @Size(min = 32, message = "auth.csrf.secret must be at least 32 characters")
    private String secret;

    @NotNull
    private Duration tokenTtl = Duration.ofHours(2);
}
