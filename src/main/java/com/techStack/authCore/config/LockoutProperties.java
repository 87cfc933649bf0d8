package com.techStack.authCore.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "auth.lockout")
public class LockoutProperties {

    @Valid
    private Track identity = new Track(5, Duration.ofSeconds(60), Duration.ofMinutes(5), 2.0, Duration.ofHours(1));

    @Valid
    private Track ip = new Track(20, Duration.ofSeconds(60), Duration.ofMinutes(5), 2.0, Duration.ofHours(1));

    @Data
    @NoArgsConstructor
    public static class Track {

        @Positive
        private int threshold;

        @NotNull
        private Duration window;

        @NotNull
        private Duration baseDuration;

        /**
         * Multiplier applied per repeated lockout. 1.0 keeps every lock at the base duration.
         */
        @DecimalMin("1.0")
        private double escalationFactor = 2.0;

        @NotNull
        private Duration maxDuration;

        public Track(int threshold, Duration window, Duration baseDuration, double escalationFactor,
                     Duration maxDuration) {
            this.threshold = threshold;
            this.window = window;
            this.baseDuration = baseDuration;
            this.escalationFactor = escalationFactor;
            this.maxDuration = maxDuration;
        }
    }
}
