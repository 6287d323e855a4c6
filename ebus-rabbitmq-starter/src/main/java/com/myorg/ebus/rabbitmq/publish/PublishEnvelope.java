package com.myorg.ebus.rabbitmq.publish;

import com.myorg.ebus.contracts.core.event.EventRecord;

import java.nio.charset.StandardCharsets;

// Wire form of one record for a single publish call.
public record PublishEnvelope(long eventId, String messageId, byte[] body, String routeKey) {

    public static PublishEnvelope from(EventRecord record) {
        String content = record.getContent() == null ? "" : record.getContent();
        return new PublishEnvelope(
                record.getEventId(),
                record.getMessageId(),
                content.getBytes(StandardCharsets.UTF_8),
                record.getEventTypeName()
        );
    }
}
