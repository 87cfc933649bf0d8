package com.techStack.authCore.service.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.techStack.authCore.models.CounterState;
import com.techStack.authCore.repository.CounterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Counter store shared across instances. Values are JSON; compare-and-set runs as a Lua script
 * so the comparison and the write are a single atomic Redis operation.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "auth.store.type", havingValue = "redis")
public class RedisCounterStore implements CounterStore {

    static final RedisScript<Long> COMPARE_AND_SET = new DefaultRedisScript<>(
            "local current = redis.call('GET', KEYS[1]) "
                    + "if (current == false and ARGV[1] == '') or current == ARGV[1] then "
                    + "  redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3]) "
                    + "  return 1 "
                    + "end "
                    + "return 0",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisCounterStore(@Qualifier("authStoreRedisTemplate") StringRedisTemplate redisTemplate,
                             @Qualifier("counterObjectMapper") ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<CounterState> get(String key) {
        String raw = redisTemplate.opsForValue().get(key);
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(raw, CounterState.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable counter state under key " + key, e);
        }
    }

    @Override
    public boolean compareAndSet(String key, CounterState expected, CounterState updated, Duration ttl) {
        Long result = redisTemplate.execute(
                COMPARE_AND_SET,
                List.of(key),
                expected == null ? "" : write(expected),
                write(updated),
                String.valueOf(Math.max(1, ttl.toMillis())));
        boolean swapped = result != null && result == 1L;
        if (!swapped) {
            log.trace("Counter compare-and-set lost the race for key {}", key);
        }
        return swapped;
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }

    private String write(CounterState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Counter state could not be serialized", e);
        }
    }
}
