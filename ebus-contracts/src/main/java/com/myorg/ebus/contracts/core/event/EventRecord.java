package com.myorg.ebus.contracts.core.event;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A domain event handed to the bus for publishing.
 *
 * <p>Owned by the caller (typically a row of an event log table). The bus only
 * reads it: {@code messageId} becomes the AMQP message-id, {@code eventTypeName}
 * the routing key and {@code content} the UTF-8 body.
 */
@Value
@Builder(toBuilder = true)
public class EventRecord {
    long eventId;             // numeric id from the event log
    @NonNull String messageId; // caller-assigned, unique per message
    String content;           // payload text, usually JSON
    @NonNull String eventTypeName; // routing key, e.g. "order.placed"

    public static EventRecord of(long eventId, String messageId, String content, String eventTypeName) {
        return new EventRecord(eventId, messageId, content, eventTypeName);
    }
}
