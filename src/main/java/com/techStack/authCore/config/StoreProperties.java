package com.techStack.authCore.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "auth.store")
public class StoreProperties {

    /**
     * {@code memory} keeps counters and revocation records in-process, {@code redis} shares them.
     */
    @NotNull
    private String type = "memory";

    @Positive
    private int shards = 64;

    @NotNull
    private Duration purgeInterval = Duration.ofMinutes(1);
}
