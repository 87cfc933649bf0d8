package com.techStack.authCore.service.store;

import com.techStack.authCore.config.StoreProperties;
import com.techStack.authCore.models.CounterState;
import com.techStack.authCore.repository.CounterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local counter store. Keys are spread over independently locked shards so that
 * unrelated keys never contend on a single lock.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "auth.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryCounterStore implements CounterStore {

    private final Shard[] shards;
    private final Clock clock;

    @Autowired
    public InMemoryCounterStore(StoreProperties storeProperties, Clock clock) {
        this(storeProperties.getShards(), clock);
    }

    public InMemoryCounterStore(int shardCount, Clock clock) {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("shardCount must be positive");
        }
        this.clock = clock;
        this.shards = new Shard[shardCount];
        for (int i = 0; i < shardCount; i++) {
            shards[i] = new Shard();
        }
    }

    @Override
    public Optional<CounterState> get(String key) {
        Shard shard = shardFor(key);
        long now = clock.millis();
        shard.lock.lock();
        try {
            return Optional.ofNullable(shard.liveValue(key, now));
        } finally {
            shard.lock.unlock();
        }
    }

    @Override
    public boolean compareAndSet(String key, CounterState expected, CounterState updated, Duration ttl) {
        Objects.requireNonNull(updated, "updated");
        Shard shard = shardFor(key);
        long now = clock.millis();
        shard.lock.lock();
        try {
            CounterState current = shard.liveValue(key, now);
            if (!Objects.equals(current, expected)) {
                return false;
            }
            shard.entries.put(key, new Entry(updated, now + ttl.toMillis()));
            return true;
        } finally {
            shard.lock.unlock();
        }
    }

    @Override
    public void delete(String key) {
        Shard shard = shardFor(key);
        shard.lock.lock();
        try {
            shard.entries.remove(key);
        } finally {
            shard.lock.unlock();
        }
    }

    @Scheduled(fixedDelayString = "${auth.store.purge-interval:PT1M}")
    public void purgeExpired() {
        long now = clock.millis();
        int removed = 0;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                int before = shard.entries.size();
                shard.entries.values().removeIf(entry -> entry.expiresAt <= now);
                removed += before - shard.entries.size();
            } finally {
                shard.lock.unlock();
            }
        }
        if (removed > 0) {
            log.debug("Purged {} expired counters", removed);
        }
    }

    public int size() {
        int total = 0;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                total += shard.entries.size();
            } finally {
                shard.lock.unlock();
            }
        }
        return total;
    }

    private Shard shardFor(String key) {
        int h = key.hashCode();
        h ^= (h >>> 16);
        return shards[Math.floorMod(h, shards.length)];
    }

    private static final class Shard {
        private final ReentrantLock lock = new ReentrantLock();
        private final Map<String, Entry> entries = new HashMap<>();

        // caller holds the lock
        private CounterState liveValue(String key, long now) {
            Entry entry = entries.get(key);
            if (entry == null) {
                return null;
            }
            if (entry.expiresAt <= now) {
                entries.remove(key);
                return null;
            }
            return entry.state;
        }
    }

    private record Entry(CounterState state, long expiresAt) {}
}
