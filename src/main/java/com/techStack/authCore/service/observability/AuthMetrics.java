package com.techStack.authCore.service.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer counters and timers for the authentication core. Tags never carry identities or addresses.
 */
@Slf4j
@Component
public class AuthMetrics {

    private final MeterRegistry meterRegistry;
    private final String prefix;

    public AuthMetrics(MeterRegistry meterRegistry,
                       @Value("${app.metrics.prefix:auth}") String prefix) {
        this.meterRegistry = meterRegistry;
        this.prefix = prefix;
    }

    public void loginOutcome(String outcome, Duration elapsed) {
        Timer.builder(prefix + ".login")
                .description("Login attempts by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(elapsed);
    }

    public void lockout(String track) {
        increment(prefix + ".lockouts", "track", track);
    }

    public void rateLimited(String scope) {
        increment(prefix + ".rate_limited", "scope", scope);
    }

    public void tokenRefresh(String outcome) {
        increment(prefix + ".token.refresh", "outcome", outcome);
    }

    public void tokenReuse() {
        increment(prefix + ".token.reuse", "severity", "critical");
    }

    public double count(String name, String tagKey, String tagValue) {
        Counter counter = meterRegistry.find(prefix + name).tag(tagKey, tagValue).counter();
        return counter == null ? 0 : counter.count();
    }

    private void increment(String name, String tagKey, String tagValue) {
        try {
            Counter.builder(name)
                    .tag(tagKey, tagValue)
                    .register(meterRegistry)
                    .increment();
        } catch (RuntimeException e) {
            log.error("Failed to record metric {}: {}", name, e.getMessage(), e);
        }
    }
}
