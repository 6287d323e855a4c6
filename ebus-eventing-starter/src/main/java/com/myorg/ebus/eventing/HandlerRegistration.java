package com.myorg.ebus.eventing;

import com.myorg.ebus.eventing.exception.UnknownEventTypeException;

import java.util.Objects;

/**
 * One queue subscription: where to consume from, what to bind, which handler to call.
 * Exactly one of {@code handler} / {@code batchHandler} is set.
 */
public record HandlerRegistration(
        String queueName,
        String eventType,
        Class<?> payloadType,
        EventHandler<?> handler,
        BatchEventHandler<?> batchHandler,
        int batchSize
) {

    public HandlerRegistration {
        Objects.requireNonNull(payloadType, "payloadType");
        if (handler == null && batchHandler == null) {
            throw new UnknownEventTypeException(queueName);
        }
        if (queueName == null || queueName.isBlank()) {
            Object target = handler != null ? handler : batchHandler;
            queueName = target.getClass().getName();
        }
        if (eventType == null || eventType.isBlank()) {
            eventType = payloadType.getName();
        }
        if (handler != null && batchHandler != null) {
            throw new IllegalArgumentException("Only one of handler/batchHandler may be set for queue=" + queueName);
        }
        if (batchHandler != null && batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive for queue=" + queueName);
        }
    }

    public static <T> HandlerRegistration single(String queueName, String eventType, Class<T> payloadType,
                                                 EventHandler<T> handler) {
        return new HandlerRegistration(queueName, eventType, payloadType, handler, null, 0);
    }

    public static <T> HandlerRegistration batch(String queueName, String eventType, Class<T> payloadType,
                                                BatchEventHandler<T> handler, int batchSize) {
        return new HandlerRegistration(queueName, eventType, payloadType, null, handler, batchSize);
    }

    public boolean isBatch() {
        return batchHandler != null;
    }
}
