package com.myorg.ebus.eventing.idempotency;

import java.time.Duration;

/**
 * Key/value store with TTL used by the consumers to suppress re-processing.
 *
 * <p>A key that {@link #exists(String, String)} means the message was already
 * handled successfully inside the idempotency window.
 */
public interface IdempotencyCache extends AutoCloseable {

    boolean exists(String key, String namespace);

    void add(String key, boolean value, Duration ttl, String namespace);

    @Override
    default void close() {
        // no-op by default
    }
}
