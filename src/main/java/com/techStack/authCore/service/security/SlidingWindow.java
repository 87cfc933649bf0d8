package com.techStack.authCore.service.security;

import com.techStack.authCore.models.CounterState;

/**
 * Sliding-window counter arithmetic used by the rate limiter.
 * <p>
 * Windows are aligned to multiples of the window length, so every instance computes the same
 * boundaries and concurrent rollovers converge. The effective count is
 * {@code previousCount * overlap + count}, where {@code overlap} is the share of the previous window
 * still inside the horizon. Once the last hit of the previous window is a full window old it no
 * longer contributes at all.
 */
final class SlidingWindow {

    private SlidingWindow() {}

    static long windowStart(long now, long windowMillis) {
        return Math.floorDiv(now, windowMillis) * windowMillis;
    }

    static CounterState roll(CounterState state, long now, long windowMillis) {
        long currentStart = windowStart(now, windowMillis);
        if (state == null) {
            return CounterState.empty(currentStart);
        }
        if (state.windowStart() >= currentStart) {
            // same window, or the clock stepped back: keep counting where we are
            return state;
        }
        if (state.windowStart() == currentStart - windowMillis) {
            return state.toBuilder()
                    .windowStart(currentStart)
                    .previousCount(state.count())
                    .previousLastHitAt(state.lastHitAt())
                    .count(0)
                    .lastHitAt(0)
                    .build();
        }
        return state.toBuilder()
                .windowStart(currentStart)
                .previousCount(0)
                .previousLastHitAt(0)
                .count(0)
                .lastHitAt(0)
                .build();
    }

    static double effectiveCount(CounterState rolled, long now, long windowMillis) {
        return previousWeight(rolled, now, windowMillis) + rolled.count();
    }

    static CounterState hit(CounterState rolled, long now) {
        return rolled.toBuilder()
                .count(rolled.count() + 1)
                .lastHitAt(now)
                .build();
    }

    /**
     * Earliest instant at which {@code limit} would admit one more hit, assuming no further traffic.
     */
    static long nextAvailableAt(CounterState rolled, long now, long windowMillis, int limit) {
        long windowEnd = rolled.windowStart() + windowMillis;
        if (rolled.count() + 1 <= limit) {
            if (rolled.previousCount() == 0) {
                return now;
            }
            double allowedWeight = limit - 1 - rolled.count();
            long decayedAt = rolled.windowStart()
                    + (long) Math.ceil(windowMillis * (1.0 - allowedWeight / rolled.previousCount()));
            long slidOutAt = rolled.previousLastHitAt() + windowMillis;
            return Math.max(now, Math.min(decayedAt, slidOutAt));
        }
        long decayedAt = windowEnd + (long) Math.ceil(windowMillis * (1.0 - (double) (limit - 1) / rolled.count()));
        long slidOutAt = rolled.lastHitAt() + windowMillis;
        return Math.max(now, Math.min(decayedAt, slidOutAt));
    }

    private static double previousWeight(CounterState rolled, long now, long windowMillis) {
        if (rolled.previousCount() <= 0 || rolled.previousLastHitAt() <= now - windowMillis) {
            return 0;
        }
        double elapsed = (double) (now - rolled.windowStart()) / windowMillis;
        double overlap = Math.min(1.0, Math.max(0.0, 1.0 - elapsed));
        return rolled.previousCount() * overlap;
    }
}
