package com.myorg.ebus.eventing.idempotency;

import com.myorg.ebus.eventing.EbusEventingProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mock.env.MockEnvironment;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class IdempotencyGuardTest {

    private final EbusEventingProperties props = new EbusEventingProperties();
    private final MockEnvironment env = new MockEnvironment();
    private final InMemoryIdempotencyCache memory = new InMemoryIdempotencyCache(10_000, Duration.ofMinutes(1));

    @SuppressWarnings("unchecked")
    private IdempotencyGuard guard(IdempotencyCache cache) {
        ObjectProvider<IdempotencyCache> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(cache);
        return new IdempotencyGuard(props, env, provider);
    }

    @AfterEach
    void close() {
        memory.close();
    }

    @Test
    void memoryFallbackOnlyWarnsOutsideProd() {
        assertThatCode(() -> guard(memory).onApplicationEvent(null)).doesNotThrowAnyException();
    }

    @Test
    void memoryFallbackFailsInProd() {
        env.setActiveProfiles("prod");

        assertThatThrownBy(() -> guard(memory).onApplicationEvent(null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void memoryFallbackFailsWhenRedisRequired() {
        props.getIdempotency().setRequireRedis(true);

        assertThatThrownBy(() -> guard(memory).onApplicationEvent(null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void explicitMemoryStoreIsAccepted() {
        env.setActiveProfiles("prod");
        props.getIdempotency().setStore("memory");

        assertThatCode(() -> guard(memory).onApplicationEvent(null)).doesNotThrowAnyException();
    }
}
