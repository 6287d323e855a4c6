package com.myorg.ebus.rabbitmq.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Publish and consume counters. Without a {@link MeterRegistry} every call is a no-op.
 */
public class EbusRabbitMetrics {

    private final MeterRegistry registry;
    private final String serviceName;

    // Pre-created so the meters exist at 0 before the first publish
    private Counter cPublishAcked;
    private Counter cPublishNacked;
    private Counter cPublishReturned;
    private Counter cPublishUnconfirmed;

    public EbusRabbitMetrics(MeterRegistry registry, String serviceName) {
        this.registry = registry;
        this.serviceName = serviceName;
    }

    public static EbusRabbitMetrics noop() {
        return new EbusRabbitMetrics(null, "none");
    }

    /** Call once on startup. */
    public void preRegisterBaseMeters() {
        if (registry == null) return;
        cPublishAcked = Counter.builder("ebus.publish.acked").tag("service", serviceName).register(registry);
        cPublishNacked = Counter.builder("ebus.publish.nacked").tag("service", serviceName).register(registry);
        cPublishReturned = Counter.builder("ebus.publish.returned").tag("service", serviceName).register(registry);
        cPublishUnconfirmed = Counter.builder("ebus.publish.unconfirmed").tag("service", serviceName).register(registry);
    }

    /** Consume meters are tagged per queue; registered when the queue's consumer starts. */
    public void preRegisterQueue(String queue) {
        if (registry == null) return;
        consumeCounter("ebus.consume.acked", queue);
        consumeCounter("ebus.consume.rejected", queue);
        consumeCounter("ebus.consume.duplicate", queue);
    }

    public void incPublishAcked(int n) { if (cPublishAcked != null) cPublishAcked.increment(n); }
    public void incPublishNacked(int n) { if (cPublishNacked != null) cPublishNacked.increment(n); }
    public void incPublishReturned(int n) { if (cPublishReturned != null) cPublishReturned.increment(n); }
    public void incPublishUnconfirmed(int n) { if (cPublishUnconfirmed != null) cPublishUnconfirmed.increment(n); }

    public void incConsumeAcked(String queue, int n) { inc("ebus.consume.acked", queue, n); }
    public void incConsumeRejected(String queue, int n) { inc("ebus.consume.rejected", queue, n); }
    public void incConsumeDuplicate(String queue) { inc("ebus.consume.duplicate", queue, 1); }

    private void inc(String name, String queue, int n) {
        if (registry == null) return;
        consumeCounter(name, queue).increment(n);
    }

    private Counter consumeCounter(String name, String queue) {
        return Counter.builder(name)
                .tag("service", serviceName)
                .tag("queue", queue)
                .register(registry);
    }
}
