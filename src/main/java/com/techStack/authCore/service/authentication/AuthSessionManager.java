package com.techStack.authCore.service.authentication;

import com.techStack.authCore.config.LoginProperties;
import com.techStack.authCore.config.TokenProperties;
import com.techStack.authCore.exception.AccountLockedException;
import com.techStack.authCore.exception.AuthException;
import com.techStack.authCore.exception.AuthServiceUnavailableException;
import com.techStack.authCore.exception.InvalidCredentialsException;
import com.techStack.authCore.exception.TokenExpiredException;
import com.techStack.authCore.exception.TokenReusedException;
import com.techStack.authCore.exception.TokenRevokedException;
import com.techStack.authCore.models.LockoutTrack;
import com.techStack.authCore.models.Principal;
import com.techStack.authCore.models.SessionState;
import com.techStack.authCore.models.SigningKey;
import com.techStack.authCore.models.TokenClaims;
import com.techStack.authCore.models.TokenKind;
import com.techStack.authCore.models.TokenPair;
import com.techStack.authCore.repository.CredentialStore;
import com.techStack.authCore.repository.TokenRevocationStore;
import com.techStack.authCore.service.observability.AuthMetrics;
import com.techStack.authCore.service.security.CsrfValidator;
import com.techStack.authCore.service.security.LockoutPolicy;
import com.techStack.authCore.service.security.RateLimiter;
import com.techStack.authCore.service.token.KeyRegistry;
import com.techStack.authCore.service.token.TokenCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.techStack.authCore.constants.SecurityConstants.SCOPE_LOGIN_IDENTITY;
import static com.techStack.authCore.constants.SecurityConstants.SCOPE_LOGIN_IP;
import static com.techStack.authCore.constants.SecurityConstants.SCOPE_REFRESH;
import static com.techStack.authCore.constants.SecurityConstants.SECURITY_MARKER;

/**
 * Entry point for login, refresh and logout. Each operation walks the
 * {@code ANONYMOUS -> AUTHENTICATING -> AUTHENTICATED <-> REFRESHING -> REVOKED} transitions for
 * tracing only; the durable per-chain state is the revoked flag kept by {@link TokenRevocationStore}.
 * <p>
 * Every refresh token belongs to a chain started by one login. Exchanging a refresh token spends
 * its jti; presenting a spent jti again revokes the whole chain.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthSessionManager {

    private final CredentialStore credentialStore;
    private final TokenCodec tokenCodec;
    private final KeyRegistry keyRegistry;
    private final RateLimiter rateLimiter;
    private final LockoutPolicy lockoutPolicy;
    private final CsrfValidator csrfValidator;
    private final TokenRevocationStore revocationStore;
    private final TokenProperties tokenProperties;
    private final LoginProperties loginProperties;
    private final AuthMetrics authMetrics;
    private final Clock clock;

    /* =========================
       Login
       ========================= */

    /**
     * Authenticates a principal and starts a new token chain.
     * <p>
     * Lockout and rate limits are checked before any credential comparison, and the attempt is counted
     * on the identity track before the comparison starts; only a success clears it. Unknown identities
     * are compared against a decoy hash and fail exactly like a wrong secret. A login cancelled or timed
     * out before its outcome is known counts as failed.
     */
    public Mono<TokenPair> login(String identity, String secret, String sourceIp) {
        return Mono.defer(() -> {
            long startedAt = System.nanoTime();
            String subject = normalizeIdentity(identity);
            String address = StringUtils.trimToNull(sourceIp);

            return attemptLogin(subject, secret, address)
                    .timeout(loginProperties.getTimeout())
                    .doOnSuccess(pair -> authMetrics.loginOutcome("success", elapsedSince(startedAt)))
                    .onErrorResume(e -> delayedFailure(startedAt, e));
        });
    }

    private Mono<TokenPair> attemptLogin(String identity, String secret, String sourceIp) {
        transition(SessionState.ANONYMOUS, SessionState.AUTHENTICATING, identity);

        Optional<Instant> lockedUntil = lockoutPolicy.lockedUntil(StringUtils.trimToNull(identity), sourceIp);
        if (lockedUntil.isPresent()) {
            return refuseLocked(identity, sourceIp, lockedUntil.get());
        }
        if (sourceIp != null) {
            rateLimiter.acquire(SCOPE_LOGIN_IP, sourceIp);
        }
        if (identity.isEmpty()) {
            if (sourceIp != null) {
                lockoutPolicy.recordFailure(LockoutTrack.IP, sourceIp);
            }
            log.info(SECURITY_MARKER, "Login without identity from {}", sourceIp);
            return Mono.error(new InvalidCredentialsException());
        }
        rateLimiter.acquire(SCOPE_LOGIN_IDENTITY, identity);

        Optional<Instant> refused = lockoutPolicy.reserveAttempt(identity);
        if (refused.isPresent()) {
            return refuseLocked(identity, sourceIp, refused.get());
        }

        return verifyCredentials(identity, secret, sourceIp)
                .map(principal -> completeLogin(principal, identity));
    }

    private Mono<TokenPair> refuseLocked(String identity, String sourceIp, Instant lockedUntil) {
        log.info(SECURITY_MARKER, "Login for {} from {} refused, locked until {}", identity, sourceIp, lockedUntil);
        return Mono.error(new AccountLockedException(lockedUntil));
    }

    // the identity track already counted this attempt at the gate
    private Mono<Principal> verifyCredentials(String identity, String secret, String sourceIp) {
        AtomicBoolean settled = new AtomicBoolean(false);
        Runnable countFailure = () -> {
            if (settled.compareAndSet(false, true) && sourceIp != null) {
                lockoutPolicy.recordFailure(LockoutTrack.IP, sourceIp);
            }
        };

        return credentialStore.findByIdentity(identity)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(found -> credentialStore
                        .compareSecret(found.map(Principal::passwordHash).orElse(credentialStore.decoyHash()), secret)
                        .defaultIfEmpty(false)
                        .map(matches -> matches ? found : Optional.<Principal>empty()))
                .onErrorMap(e -> !(e instanceof AuthException), AuthServiceUnavailableException::new)
                .doOnError(e -> countFailure.run())
                .doOnCancel(countFailure)
                .flatMap(match -> {
                    if (match.isEmpty()) {
                        countFailure.run();
                        transition(SessionState.AUTHENTICATING, SessionState.ANONYMOUS, identity);
                        log.info(SECURITY_MARKER, "Invalid credentials for {} from {}", identity, sourceIp);
                        return Mono.error(new InvalidCredentialsException());
                    }
                    settled.set(true);
                    return Mono.just(match.get());
                });
    }

    private TokenPair completeLogin(Principal principal, String identity) {
        lockoutPolicy.recordSuccess(identity);
        TokenPair pair = issuePair(principal.id(), principal.roles(), UUID.randomUUID().toString());
        transition(SessionState.AUTHENTICATING, SessionState.AUTHENTICATED, pair.chainId());
        log.info("Login succeeded for principal {} (chain {})", principal.id(), pair.chainId());
        return pair;
    }

    private Mono<TokenPair> delayedFailure(long startedAt, Throwable error) {
        AuthException failure = asAuthException(error);
        Duration elapsed = elapsedSince(startedAt);
        authMetrics.loginOutcome(failure.getErrorCode().name().toLowerCase(Locale.ROOT), elapsed);

        Mono<TokenPair> result = Mono.error(failure);
        Duration remaining = loginProperties.getMinimumFailureDuration().minus(elapsed);
        return remaining.isNegative() || remaining.isZero() ? result : result.delaySubscription(remaining);
    }

    /* =========================
       Refresh
       ========================= */

    /**
     * Exchanges a refresh token for a new pair on the same chain. The presented token is spent.
     * Store calls run on the bounded elastic scheduler; a refresh that outlives the timeout fails
     * with {@link AuthServiceUnavailableException} while the store call finishes in the background.
     */
    public Mono<TokenPair> refresh(String refreshToken) {
        return Mono.fromCallable(() -> rotate(refreshToken))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(loginProperties.getTimeout())
                .onErrorMap(TimeoutException.class, AuthServiceUnavailableException::new)
                .doOnError(AuthException.class,
                        e -> authMetrics.tokenRefresh(e.getErrorCode().name().toLowerCase(Locale.ROOT)));
    }

    private TokenPair rotate(String refreshToken) {
        TokenClaims claims = tokenCodec.verify(refreshToken, keyRegistry.verifiable(), TokenKind.REFRESH);
        String chainId = claims.chainId();
        transition(SessionState.AUTHENTICATED, SessionState.REFRESHING, chainId);
        rateLimiter.acquire(SCOPE_REFRESH, claims.subject());

        if (revocationStore.isChainRevoked(chainId)) {
            transition(SessionState.REFRESHING, SessionState.REVOKED, chainId);
            log.warn(SECURITY_MARKER, "Refresh attempted on revoked chain {} by subject {}",
                    chainId, claims.subject());
            throw new TokenRevokedException();
        }

        if (!revocationStore.markSpent(claims.jti(), spentRetention(claims))) {
            revocationStore.revokeChain(chainId, chainRevocationHorizon());
            transition(SessionState.REFRESHING, SessionState.REVOKED, chainId);
            authMetrics.tokenReuse();
            log.error(SECURITY_MARKER,
                    "Refresh token {} replayed for subject {} (signed by {}); chain {} revoked",
                    claims.jti(), claims.subject(), claims.keyId(), chainId);
            throw new TokenReusedException();
        }

        TokenPair pair = issuePair(claims.subject(), claims.roles(), chainId);
        transition(SessionState.REFRESHING, SessionState.AUTHENTICATED, chainId);
        authMetrics.tokenRefresh("rotated");
        log.debug("Refresh token {} rotated on chain {}", claims.jti(), chainId);
        return pair;
    }

    /* =========================
       Logout and Access Checks
       ========================= */

    /**
     * Revokes the chain the refresh token belongs to. An already expired token completes quietly.
     */
    public Mono<Void> logout(String refreshToken) {
        return Mono.fromRunnable(() -> revokeChainOf(refreshToken));
    }

    private void revokeChainOf(String refreshToken) {
        TokenClaims claims;
        try {
            claims = tokenCodec.verify(refreshToken, keyRegistry.verifiable(), TokenKind.REFRESH);
        } catch (TokenExpiredException e) {
            log.debug("Logout with an expired refresh token, nothing left to revoke");
            return;
        }

        revocationStore.revokeChain(claims.chainId(), chainRevocationHorizon());
        revocationStore.markSpent(claims.jti(), spentRetention(claims));
        transition(SessionState.AUTHENTICATED, SessionState.REVOKED, claims.chainId());
        log.info("Chain {} of subject {} revoked by logout", claims.chainId(), claims.subject());
    }

    /**
     * Verifies an access token and rejects it if its chain has been revoked.
     */
    public Mono<TokenClaims> authenticate(String accessToken) {
        return Mono.fromCallable(() -> {
            TokenClaims claims = tokenCodec.verify(accessToken, keyRegistry.verifiable(), TokenKind.ACCESS);
            if (revocationStore.isChainRevoked(claims.chainId())) {
                log.info(SECURITY_MARKER, "Access token {} rejected, chain {} revoked", claims.jti(), claims.chainId());
                throw new TokenRevokedException();
            }
            return claims;
        });
    }

    /* =========================
       CSRF
       ========================= */

    public String issueCsrf(String sessionId) {
        return csrfValidator.issue(sessionId);
    }

    public boolean verifyCsrf(String sessionId, String token) {
        return csrfValidator.verify(sessionId, token);
    }

    /* =========================
       Helpers
       ========================= */

    private TokenPair issuePair(String subject, Set<String> roles, String chainId) {
        SigningKey key = keyRegistry.active();
        Instant now = clock.instant();

        TokenClaims access = TokenClaims.builder()
                .subject(subject)
                .roles(roles)
                .issuedAt(now)
                .expiresAt(now.plus(tokenProperties.getAccessTokenTtl()))
                .kind(TokenKind.ACCESS)
                .jti(UUID.randomUUID().toString())
                .keyId(key.getKeyId())
                .chainId(chainId)
                .build();
        TokenClaims refresh = access.toBuilder()
                .kind(TokenKind.REFRESH)
                .jti(UUID.randomUUID().toString())
                .expiresAt(now.plus(tokenProperties.getRefreshTokenTtl()))
                .build();

        return new TokenPair(
                tokenCodec.issue(access, key),
                tokenCodec.issue(refresh, key),
                access.expiresAt(),
                refresh.expiresAt(),
                chainId);
    }

    private Instant spentRetention(TokenClaims claims) {
        return claims.expiresAt().plus(tokenProperties.getClockSkew());
    }

    // no token of the chain issued before now can outlive this
    private Instant chainRevocationHorizon() {
        return clock.instant()
                .plus(tokenProperties.getRefreshTokenTtl())
                .plus(tokenProperties.getClockSkew());
    }

    private void transition(SessionState from, SessionState to, String reference) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal session transition " + from + " -> " + to);
        }
        if (to.isTerminal()) {
            log.debug("Session {}: {} -> {}, chain closed", reference, from, to);
        } else {
            log.trace("Session {}: {} -> {}", reference, from, to);
        }
    }

    private static AuthException asAuthException(Throwable error) {
        if (error instanceof AuthException authException) {
            return authException;
        }
        log.error("Login failed closed on unexpected error: {}", error.toString());
        return new AuthServiceUnavailableException(error);
    }

    private static String normalizeIdentity(String identity) {
        return identity == null ? "" : identity.trim().toLowerCase(Locale.ROOT);
    }

    private static Duration elapsedSince(long startedAtNanos) {
        return Duration.ofNanos(System.nanoTime() - startedAtNanos);
    }
}
