package com.techStack.authCore.models;

import lombok.Builder;

import java.util.List;

/**
 * Persisted value of a rate window or failed-attempt counter.
 * Timestamps are epoch milliseconds; {@code lockedUntil} is null while no lock has been applied.
 * {@code recentHits} holds the timestamps of the latest failures, oldest first, for exact
 * per-window counting on lockout tracks.
 */
@Builder(toBuilder = true)
public record CounterState(
        long count,
        long windowStart,
        Long lockedUntil,
        long previousCount,
        long lastHitAt,
        long previousLastHitAt,
        int lockouts,
        List<Long> recentHits
) {

    public CounterState {
        recentHits = recentHits == null ? List.of() : List.copyOf(recentHits);
    }

    public static CounterState empty(long windowStart) {
        return new CounterState(0, windowStart, null, 0, 0, 0, 0, List.of());
    }

    public boolean isLocked(long nowMillis) {
        return lockedUntil != null && lockedUntil > nowMillis;
    }
}
