package com.techStack.authCore.service.store;

import com.techStack.authCore.repository.TokenRevocationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "auth.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryTokenRevocationStore implements TokenRevocationStore {

    private final Map<String, Instant> spentJtis = new ConcurrentHashMap<>();
    private final Map<String, Instant> revokedChains = new ConcurrentHashMap<>();
    private final Clock clock;

    @Override
    public boolean markSpent(String jti, Instant until) {
        Instant now = clock.instant();
        AtomicBoolean spentNow = new AtomicBoolean(false);
        spentJtis.compute(jti, (key, existing) -> {
            if (existing != null && existing.isAfter(now)) {
                return existing;
            }
            spentNow.set(true);
            return until;
        });
        return spentNow.get();
    }

    @Override
    public boolean isSpent(String jti) {
        return isLive(spentJtis.get(jti));
    }

    @Override
    public void revokeChain(String chainId, Instant until) {
        revokedChains.merge(chainId, until, (existing, requested) -> existing.isAfter(requested) ? existing : requested);
    }

    @Override
    public boolean isChainRevoked(String chainId) {
        return isLive(revokedChains.get(chainId));
    }

    @Scheduled(fixedDelayString = "${auth.store.purge-interval:PT1M}")
    public void purgeExpired() {
        Instant now = clock.instant();
        spentJtis.values().removeIf(until -> !until.isAfter(now));
        revokedChains.values().removeIf(until -> !until.isAfter(now));
        log.debug("Revocation store holds {} spent ids and {} revoked chains", spentJtis.size(), revokedChains.size());
    }

    private boolean isLive(Instant until) {
        return until != null && until.isAfter(clock.instant());
    }
}
