package com.techStack.authCore.repository;

import com.techStack.authCore.models.CounterState;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Keyed store of rate windows and failed-attempt counters with atomic compare-and-set and expiry.
 * Implementations may be shared between instances; callers never assume process affinity.
 */
public interface CounterStore {

    int MAX_CAS_ATTEMPTS = 128;

    Optional<CounterState> get(String key);

    /**
     * Stores {@code updated} only if the current value equals {@code expected}
     * ({@code null} meaning absent or expired).
     */
    boolean compareAndSet(String key, CounterState expected, CounterState updated, Duration ttl);

    void delete(String key);

    /**
     * Applies {@code mutation} through a compare-and-set loop so that concurrent updates
     * on the same key are never lost. The mutation may run more than once and must be pure.
     *
     * @param mutation receives the current state, or null when there is none; returning the
     *                 argument unchanged leaves the store untouched
     * @return the state that was stored, or the unchanged current state
     */
    default CounterState update(String key,
                                UnaryOperator<CounterState> mutation,
                                Function<CounterState, Duration> ttl) {
        for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
            CounterState current = get(key).orElse(null);
            CounterState next = mutation.apply(current);
            if (Objects.equals(next, current)) {
                return current;
            }
            if (compareAndSet(key, current, next, ttl.apply(next))) {
                return next;
            }
        }
        throw new IllegalStateException("Counter update did not converge for key " + key);
    }
}
