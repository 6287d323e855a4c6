package com.myorg.ebus.eventing.idempotency;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class InMemoryIdempotencyCacheTest {

    private final InMemoryIdempotencyCache cache = new InMemoryIdempotencyCache("ebus:test", 10_000, Duration.ofMinutes(5));

    @AfterEach
    void close() {
        cache.close();
    }

    @Test
    void addedKeyExistsUntilTtlElapses() {
        String key = new IdempotencyKey("orders.queue", "m1").asCacheKey();
        assertThat(cache.exists(key, "Events")).isFalse();

        cache.add(key, true, Duration.ofMillis(200), "Events");

        assertThat(cache.exists(key, "Events")).isTrue();
        await().atMost(Duration.ofSeconds(2)).until(() -> !cache.exists(key, "Events"));
    }

    @Test
    void namespacesAndQueuesAreSeparate() {
        cache.add(new IdempotencyKey("q1", "m1").asCacheKey(), true, Duration.ofMinutes(1), "Events");

        assertThat(cache.exists("q1:m1", "Other")).isFalse();
        assertThat(cache.exists(new IdempotencyKey("q2", "m1").asCacheKey(), "Events")).isFalse();
        assertThat(cache.exists("q1:m1", "Events")).isTrue();
    }

    @Test
    void cleanupDropsExpiredEntries() throws InterruptedException {
        cache.add("q:m", true, Duration.ofMillis(1), "Events");
        Thread.sleep(20);

        cache.cleanupExpired();

        assertThat(cache.size()).isZero();
    }

    @Test
    void ttlMustBePositive() {
        assertThatThrownBy(() -> cache.add("q:m", true, Duration.ZERO, "Events"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
