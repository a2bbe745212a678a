package com.docspace.backend.modules.auth.infrastructure.session;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

@Component
public class RedisExpiringKeyValueStore implements ExpiringKeyValueStore {

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> compareAndSetScript;

    public RedisExpiringKeyValueStore(StringRedisTemplate redisTemplate, RedisScript<Long> compareAndSetScript) {
        this.redisTemplate = redisTemplate;
        this.compareAndSetScript = compareAndSetScript;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        requirePositive(ttl);
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(key));
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(key));
    }

    @Override
    public Optional<String> getAndDelete(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().getAndDelete(key));
    }

    @Override
    public boolean compareAndSet(String key, String expected, String newValue, Duration ttl) {
        requirePositive(ttl);
        Long result = redisTemplate.execute(
                compareAndSetScript,
                List.of(key),
                expected,
                newValue,
                String.valueOf(ttl.toMillis())
        );
        return result != null && result == 1L;
    }

    private static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }
}
