package com.myorg.ebus.eventing;

/**
 * Handles one delivered event.
 *
 * <p>Return {@code true} when the event was processed and may be acknowledged,
 * {@code false} to reject it. Exceptions are treated like {@code false}.
 */
@FunctionalInterface
public interface EventHandler<T> {
    boolean handle(T event, CancellationToken cancellationToken) throws Exception;
}
