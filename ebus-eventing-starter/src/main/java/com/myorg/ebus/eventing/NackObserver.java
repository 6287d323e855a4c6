package com.myorg.ebus.eventing;

import java.util.List;

/**
 * Called when a delivery (or batch) failed. The return value is the requeue
 * decision for the broker reject/nack.
 *
 * @param error    the handler or deserialization exception, {@code null} when the handler returned false
 * @param payloads deserialized payloads; empty when the body could not be read
 */
@FunctionalInterface
public interface NackObserver {
    boolean onNack(List<String> messageIds, String queueName, Throwable error, List<?> payloads);
}
