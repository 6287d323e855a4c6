package com.myorg.ebus.eventing;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

// Subscriptions keyed by queue name. Filled once at startup (scanner or
// programmatic register calls), read by the consumer lifecycle.
public class HandlerRegistry {
    private final Map<String, HandlerRegistration> handlers = new ConcurrentHashMap<>();

    public void register(HandlerRegistration registration) {
        HandlerRegistration prev = handlers.putIfAbsent(registration.queueName(), registration);
        if (prev != null && prev != registration) {
            throw new IllegalStateException("Queue already has a handler: " + registration.queueName());
        }
    }

    public List<HandlerRegistration> all() {
        return List.copyOf(handlers.values());
    }
}
