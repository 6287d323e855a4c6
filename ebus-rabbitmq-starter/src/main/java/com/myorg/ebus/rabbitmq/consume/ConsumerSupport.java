package com.myorg.ebus.rabbitmq.consume;

import com.myorg.ebus.eventing.EbusEventingProperties;
import com.myorg.ebus.eventing.PayloadConverter;
import com.myorg.ebus.eventing.idempotency.IdempotencyCache;
import com.myorg.ebus.eventing.idempotency.IdempotencyKey;
import com.myorg.ebus.eventing.resilience.HandlerExecutionPolicy;
import com.myorg.ebus.rabbitmq.connection.BrokerConnection;
import com.myorg.ebus.rabbitmq.metrics.EbusRabbitMetrics;

/**
 * What a consumer needs besides its channel. {@code cache} is {@code null}
 * when no idempotency cache is configured.
 */
public record ConsumerSupport(
        BrokerConnection connection,
        PayloadConverter converter,
        HandlerExecutionPolicy policy,
        IdempotencyCache cache,
        EbusEventingProperties.Idempotency idempotency,
        ConsumerObservers observers,
        EbusRabbitMetrics metrics
) {

    public boolean deduplicates(String messageId) {
        return cache != null && idempotency.isActive() && messageId != null && !messageId.isBlank();
    }

    public boolean alreadyHandled(String queue, String messageId) {
        return deduplicates(messageId)
                && cache.exists(new IdempotencyKey(queue, messageId).asCacheKey(), idempotency.getNamespace());
    }

    public void rememberHandled(String queue, String messageId) {
        if (!deduplicates(messageId)) return;
        cache.add(new IdempotencyKey(queue, messageId).asCacheKey(), true, idempotency.getWindow(), idempotency.getNamespace());
    }

    void ensureConnected() {
        if (!connection.isConnected()) {
            connection.tryConnect();
        }
    }
}
