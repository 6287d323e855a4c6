package com.myorg.ebus.rabbitmq.consume;

import com.myorg.ebus.eventing.AckObserver;
import com.myorg.ebus.eventing.NackObserver;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Ack / nack observers shared by every consumer of a bus. Replaceable at
 * runtime; without a nack observer failed deliveries are requeued.
 */
@Slf4j
public class ConsumerObservers {

    private volatile AckObserver ackObserver;
    private volatile NackObserver nackObserver;

    public void install(AckObserver ackObserver, NackObserver nackObserver) {
        this.ackObserver = ackObserver;
        this.nackObserver = nackObserver;
    }

    public void acked(List<String> messageIds, String queue) {
        AckObserver o = ackObserver;
        if (o == null) return;
        try {
            o.onAck(messageIds, queue);
        } catch (Exception e) {
            log.error("Ack observer failed queue={} messageIds={}", queue, messageIds, e);
        }
    }

    /** @return the requeue decision */
    public boolean nacked(List<String> messageIds, String queue, Throwable error, List<?> payloads) {
        NackObserver o = nackObserver;
        if (o == null) return true;
        try {
            return o.onNack(messageIds, queue, error, payloads);
        } catch (Exception e) {
            log.error("Nack observer failed queue={} messageIds={}, requeueing", queue, messageIds, e);
            return true;
        }
    }
}
