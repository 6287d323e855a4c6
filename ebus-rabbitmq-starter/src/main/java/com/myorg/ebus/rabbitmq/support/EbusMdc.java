package com.myorg.ebus.rabbitmq.support;

import org.slf4j.MDC;

public final class EbusMdc {
    public static final String QUEUE = "ebusQueue";
    public static final String MESSAGE_ID = "ebusMessageId";
    public static final String ROUTE_KEY = "ebusRouteKey";

    private EbusMdc() {
    }

    public static void put(String queue, String messageId, String routeKey) {
        if (queue != null) MDC.put(QUEUE, queue);
        if (messageId != null) MDC.put(MESSAGE_ID, messageId);
        if (routeKey != null) MDC.put(ROUTE_KEY, routeKey);
    }

    public static void clear() {
        MDC.remove(QUEUE);
        MDC.remove(MESSAGE_ID);
        MDC.remove(ROUTE_KEY);
    }
}
