package com.myorg.ebus.eventing.idempotency;

/**
 * Composite key of a handled message: the same message id consumed by two
 * queues is tracked separately.
 */
public record IdempotencyKey(String queueName, String messageId) {

    public String asCacheKey() {
        return queueName + ":" + messageId;
    }

    @Override
    public String toString() {
        return asCacheKey();
    }
}
