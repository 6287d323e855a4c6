package com.myorg.ebus.rabbitmq.consume;

import com.myorg.ebus.eventing.Subscription;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Owns the running subscriptions of a bus; used for teardown. */
@Slf4j
public class ConsumerRegistry implements AutoCloseable {

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    public void add(Subscription subscription) {
        subscriptions.add(subscription);
    }

    public List<Subscription> all() {
        return List.copyOf(subscriptions);
    }

    public boolean contains(String queueName) {
        return subscriptions.stream().anyMatch(s -> s.queueName().equals(queueName));
    }

    @Override
    public void close() {
        for (Subscription s : subscriptions) {
            try {
                s.close();
            } catch (RuntimeException e) {
                log.warn("Closing subscription failed queue={}", s.queueName(), e);
            }
        }
        if (!subscriptions.isEmpty()) {
            log.info("Closed {} subscription(s)", subscriptions.size());
        }
        subscriptions.clear();
    }
}
