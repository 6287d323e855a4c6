package com.myorg.ebus.eventing;

import com.myorg.ebus.contracts.core.event.EventRecord;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Publishes event records and wires queue subscriptions to handlers.
 */
public interface EventBus {

    Duration DEFAULT_CONFIRM_TIMEOUT = Duration.ofMillis(500);
    int DEFAULT_CONFIRM_BATCH_SIZE = 500;

    /** Fire-and-forget: no delivery guarantee, failures are logged. */
    void publishNonConfirm(List<EventRecord> events, int delaySeconds);

    /**
     * Confirmed publish. Each handler receives the records whose ids were acked,
     * nacked or returned as unroutable, in chunks of at most {@code batchSize}.
     */
    void publish(List<EventRecord> events,
                 Consumer<List<EventRecord>> ackHandler,
                 Consumer<List<EventRecord>> nackHandler,
                 Consumer<List<EventRecord>> returnHandler,
                 int delaySeconds,
                 Duration timeout,
                 int batchSize);

    /** Confirmed publish; {@code true} only when every record was acked. */
    boolean publish(List<EventRecord> events, int delaySeconds, Duration timeout, int batchSize);

    default boolean publish(List<EventRecord> events) {
        return publish(events, 0, DEFAULT_CONFIRM_TIMEOUT, DEFAULT_CONFIRM_BATCH_SIZE);
    }

    Subscription register(HandlerRegistration registration);

    /** Installs the observers used by every subscription of this bus. */
    EventBus subscribe(AckObserver ackObserver, NackObserver nackObserver);
}
