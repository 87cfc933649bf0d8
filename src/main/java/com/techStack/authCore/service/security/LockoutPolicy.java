package com.techStack.authCore.service.security;

import com.techStack.authCore.config.LockoutProperties;
import com.techStack.authCore.models.CounterState;
import com.techStack.authCore.models.LockoutTrack;
import com.techStack.authCore.repository.CounterStore;
import com.techStack.authCore.service.observability.AuthMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static com.techStack.authCore.constants.SecurityConstants.SECURITY_MARKER;

/**
 * Failed-attempt counting and temporary locks, kept on two independent tracks: one per identity
 * and one per source address.
 * <p>
 * A lock engages when the threshold is reached inside any window-long span, counted from the
 * timestamps of the latest failures. Each further lockout multiplies
 * the lock duration by the escalation factor up to the configured maximum, and {@code lockedUntil}
 * never moves backwards while failures keep coming. Only a successful login (identity track) or an
 * explicit unlock clears it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LockoutPolicy {

    private final CounterStore counterStore;
    private final LockoutProperties lockoutProperties;
    private final AuthMetrics authMetrics;
    private final Clock clock;

    /* =========================
       Failure Recording
       ========================= */

    /**
     * Records a failure on both tracks.
     *
     * @return the later of the two locks, if either track is now locked
     */
    public Optional<Instant> recordFailure(String identity, String sourceIp) {
        Optional<Instant> identityLock = recordFailure(LockoutTrack.IDENTITY, identity);
        Optional<Instant> ipLock = sourceIp == null ? Optional.empty() : recordFailure(LockoutTrack.IP, sourceIp);
        return later(identityLock, ipLock);
    }

    public Optional<Instant> recordFailure(LockoutTrack track, String subject) {
        return activeLock(countFailure(track, subject, false).state());
    }

    /**
     * Counts a login attempt against the identity track before its credentials are compared, so
     * that concurrent attempts cannot all slip in under the threshold. An attempt arriving while the
     * identity is locked is refused and not counted; the attempt that engages the lock still proceeds.
     *
     * @return the lock expiry if the attempt was refused
     */
    public Optional<Instant> reserveAttempt(String identity) {
        FailureOutcome outcome = countFailure(LockoutTrack.IDENTITY, identity, true);
        if (outcome.refused()) {
            return Optional.of(Instant.ofEpochMilli(outcome.state().lockedUntil()));
        }
        return Optional.empty();
    }

    private FailureOutcome countFailure(LockoutTrack track, String subject, boolean refuseWhileLocked) {
        LockoutProperties.Track policy = policyFor(track);
        long windowMillis = policy.getWindow().toMillis();
        AtomicBoolean newlyLocked = new AtomicBoolean();
        AtomicBoolean refused = new AtomicBoolean();

        CounterState stored = counterStore.update(keyFor(track, subject), current -> {
            newlyLocked.set(false);
            refused.set(false);
            long now = clock.millis();
            if (refuseWhileLocked && current != null && current.isLocked(now)) {
                refused.set(true);
                return current;
            }

            CounterState base = current == null ? CounterState.empty(now) : current;
            List<Long> hits = hitsWithin(base, now, windowMillis);
            hits.add(now);
            if (hits.size() > policy.getThreshold()) {
                hits = hits.subList(hits.size() - policy.getThreshold(), hits.size());
            }
            if (hits.size() < policy.getThreshold()) {
                return base.toBuilder()
                        .count(hits.size())
                        .windowStart(hits.get(0))
                        .lastHitAt(now)
                        .recentHits(hits)
                        .build();
            }

            int lockouts = base.lockouts() + 1;
            long until = now + lockDuration(policy, lockouts).toMillis();
            long lockedUntil = base.lockedUntil() == null ? until : Math.max(base.lockedUntil(), until);
            newlyLocked.set(true);
            return base.toBuilder()
                    .count(0)
                    .windowStart(now)
                    .lastHitAt(now)
                    .recentHits(List.of())
                    .lockouts(lockouts)
                    .lockedUntil(lockedUntil)
                    .build();
        }, state -> ttlFor(state, policy));

        if (refused.get()) {
            log.debug("Attempt on {} track for {} refused while locked", track.getScope(), subject);
        } else if (newlyLocked.get()) {
            log.warn(SECURITY_MARKER, "Lockout #{} on {} track for {} until {}",
                    stored.lockouts(), track.getScope(), subject, Instant.ofEpochMilli(stored.lockedUntil()));
            authMetrics.lockout(track.getScope());
        } else {
            log.debug("Failure recorded on {} track for {} ({} in current window)",
                    track.getScope(), subject, stored.count());
        }
        return new FailureOutcome(stored, refused.get());
    }

    /**
     * Clears the identity track. The IP track is left alone: one good login from an address says
     * nothing about the other identities tried from it.
     */
    public void recordSuccess(String identity) {
        counterStore.delete(keyFor(LockoutTrack.IDENTITY, identity));
        log.debug("Failure counter cleared for {}", identity);
    }

    public void unlock(LockoutTrack track, String subject) {
        counterStore.delete(keyFor(track, subject));
        log.info(SECURITY_MARKER, "Manual unlock on {} track for {}", track.getScope(), subject);
    }

    /* =========================
       Lock Status Checks
       ========================= */

    public boolean isLocked(String identity) {
        return isLocked(LockoutTrack.IDENTITY, identity);
    }

    public boolean isLocked(LockoutTrack track, String subject) {
        return lockedUntil(track, subject).isPresent();
    }

    public Optional<Instant> lockedUntil(LockoutTrack track, String subject) {
        if (subject == null) {
            return Optional.empty();
        }
        return counterStore.get(keyFor(track, subject)).flatMap(this::activeLock);
    }

    public Optional<Instant> lockedUntil(String identity, String sourceIp) {
        return later(lockedUntil(LockoutTrack.IDENTITY, identity), lockedUntil(LockoutTrack.IP, sourceIp));
    }

    public long failureCount(LockoutTrack track, String subject) {
        long windowMillis = policyFor(track).getWindow().toMillis();
        long now = clock.millis();
        return counterStore.get(keyFor(track, subject))
                .map(state -> (long) hitsWithin(state, now, windowMillis).size())
                .orElse(0L);
    }

    /* =========================
       Helpers
       ========================= */

    Duration lockDuration(LockoutProperties.Track policy, int lockouts) {
        double base = policy.getBaseDuration().toMillis();
        double escalated = base * Math.pow(policy.getEscalationFactor(), Math.max(0, lockouts - 1));
        long capped = (long) Math.min(escalated, policy.getMaxDuration().toMillis());
        return Duration.ofMillis(capped);
    }

    // failures newer than one window before now, oldest first
    private static List<Long> hitsWithin(CounterState state, long now, long windowMillis) {
        List<Long> hits = new ArrayList<>();
        for (Long at : state.recentHits()) {
            if (at > now - windowMillis) {
                hits.add(at);
            }
        }
        return hits;
    }

    private Duration ttlFor(CounterState state, LockoutProperties.Track policy) {
        Duration base = policy.getWindow().multipliedBy(2);
        if (state.lockedUntil() == null) {
            return base;
        }
        Duration remainingLock = Duration.ofMillis(Math.max(0, state.lockedUntil() - clock.millis()));
        return remainingLock.plus(base);
    }

    private Optional<Instant> activeLock(CounterState state) {
        return state.isLocked(clock.millis())
                ? Optional.of(Instant.ofEpochMilli(state.lockedUntil()))
                : Optional.empty();
    }

    private LockoutProperties.Track policyFor(LockoutTrack track) {
        return track == LockoutTrack.IDENTITY ? lockoutProperties.getIdentity() : lockoutProperties.getIp();
    }

    private static String keyFor(LockoutTrack track, String subject) {
        return track.getScope() + ":" + subject;
    }

    private record FailureOutcome(CounterState state, boolean refused) {}

    @SafeVarargs
    private static Optional<Instant> later(Optional<Instant>... locks) {
        return Stream.of(locks)
                .flatMap(Optional::stream)
                .max(Comparator.naturalOrder());
    }
}
