package com.docspace.backend.modules.auth.infrastructure.session;

import java.time.Duration;
import java.util.Optional;

/**
 * String key-value store whose entries expire on their own. Backs refresh tokens,
 * the access-token blacklist and password reset tokens.
 */
public interface ExpiringKeyValueStore {

    void set(String key, String value, Duration ttl);

    Optional<String> get(String key);

    boolean exists(String key);

    /**
     * @return {@code true} when a key was removed
     */
    boolean delete(String key);

    /**
     * Reads and removes the value in one atomic step.
     */
    Optional<String> getAndDelete(String key);

    /**
     * Atomically replaces the value of {@code key} with {@code newValue} only if it currently equals
     * {@code expected}. Of several concurrent callers presenting the same expected value at most one wins.
     */
    boolean compareAndSet(String key, String expected, String newValue, Duration ttl);
}
