package com.docspace.backend.global.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis scripts shared by the session store. Connection settings come from
 * {@code spring.data.redis.*}; the {@code StringRedisTemplate} is Boot's auto-configured one.
 */
@Configuration(proxyBeanMethods = false)
public class RedisConfig {

    /**
     * Replaces KEYS[1] with ARGV[2] (TTL ARGV[3] milliseconds) only when it currently holds ARGV[1].
     */
    static final String COMPARE_AND_SET_LUA = """
            if redis.call('GET', KEYS[1]) == ARGV[1] then
              redis.call('SET', KEYS[1], ARGV[2], 'PX', tonumber(ARGV[3]))
              return 1
            end
            return 0
            """;

    @Bean
    public RedisScript<Long> compareAndSetScript() {
        return new DefaultRedisScript<>(COMPARE_AND_SET_LUA, Long.class);
    }
}
