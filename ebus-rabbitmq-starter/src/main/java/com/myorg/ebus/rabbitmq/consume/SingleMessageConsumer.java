package com.myorg.ebus.rabbitmq.consume;

import com.myorg.ebus.eventing.EventHandler;
import com.myorg.ebus.eventing.HandlerRegistration;
import com.myorg.ebus.eventing.Subscription;
import com.myorg.ebus.rabbitmq.support.EbusMdc;
import com.myorg.ebus.rabbitmq.topology.ConsumerTopology;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Push consumer for one queue: each delivery is deduplicated, handled under
 * the registration's policy, then acked or rejected individually.
 *
 * <p>Deliveries run on the client's dispatch thread. Nothing thrown while
 * handling a delivery reaches the client library.
 */
@Slf4j
public class SingleMessageConsumer extends DefaultConsumer implements Subscription {

    public enum State { IDLE, DECLARED, CONSUMING, CANCELLED }

    private final HandlerRegistration registration;
    private final ConsumerSupport support;
    private final EventHandler<Object> handler;
    private volatile State state = State.IDLE;

    @SuppressWarnings("unchecked")
    public SingleMessageConsumer(Channel channel, HandlerRegistration registration, ConsumerSupport support) {
        super(channel);
        if (registration.isBatch()) {
            throw new IllegalArgumentException("Batch registration given to single consumer, queue=" + registration.queueName());
        }
        this.registration = registration;
        this.support = support;
        this.handler = (EventHandler<Object>) registration.handler();
    }

    public void start(String exchange, String exchangeType, int prefetch) throws IOException {
        String queue = registration.queueName();
        ConsumerTopology.declare(getChannel(), exchange, exchangeType, queue, registration.eventType(), prefetch);
        state = State.DECLARED;
        support.metrics().preRegisterQueue(queue);
        getChannel().basicConsume(queue, false, this);
    }

    @Override
    public void handleConsumeOk(String consumerTag) {
        super.handleConsumeOk(consumerTag);
        state = State.CONSUMING;
        log.info("Consumer started queue={} consumerTag={}", registration.queueName(), consumerTag);
    }

    @Override
    public void handleCancelOk(String consumerTag) {
        state = State.CANCELLED;
        log.info("Consumer cancelled queue={} consumerTag={}", registration.queueName(), consumerTag);
    }

    @Override
    public void handleCancel(String consumerTag) {
        state = State.CANCELLED;
        log.warn("Consumer cancelled by broker queue={} consumerTag={}", registration.queueName(), consumerTag);
    }

    @Override
    public void handleRecoverOk(String consumerTag) {
        // automatic recovery re-registered the consumer on a new channel
        state = State.CONSUMING;
        log.info("Consumer recovered queue={} consumerTag={}", registration.queueName(), consumerTag);
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
        state = State.CANCELLED;
        if (sig.isInitiatedByApplication()) {
            log.info("Consumer shut down queue={} consumerTag={}", registration.queueName(), consumerTag);
        } else {
            log.warn("Consumer shut down queue={} consumerTag={} reason={}", registration.queueName(), consumerTag, sig.getMessage());
        }
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        String messageId = properties == null ? null : properties.getMessageId();
        long tag = envelope.getDeliveryTag();
        EbusMdc.put(registration.queueName(), messageId, envelope.getRoutingKey());
        try {
            onDelivery(tag, messageId, body);
        } catch (Exception e) {
            log.error("Delivery handling failed queue={} messageId={} deliveryTag={}",
                    registration.queueName(), messageId, tag, e);
        } finally {
            EbusMdc.clear();
        }
    }

    private void onDelivery(long tag, String messageId, byte[] body) throws IOException {
        String queue = registration.queueName();
        support.ensureConnected();

        List<String> ids = messageId == null ? List.of() : List.of(messageId);
        boolean duplicate;
        try {
            duplicate = support.alreadyHandled(queue, messageId);
        } catch (RuntimeException e) {
            log.warn("Idempotency lookup failed queue={} messageId={}", queue, messageId, e);
            reject(tag, messageId, ids, e, List.of());
            return;
        }
        if (duplicate) {
            getChannel().basicAck(tag, false);
            support.metrics().incConsumeDuplicate(queue);
            log.debug("Duplicate delivery acked queue={} messageId={}", queue, messageId);
            return;
        }

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Object payload = null;
        boolean ok = false;
        try {
            payload = support.converter().read(body, registration.payloadType());
        } catch (RuntimeException e) {
            failure.set(e);
            log.warn("Undeserializable delivery queue={} messageId={} type={}",
                    queue, messageId, registration.payloadType().getName(), e);
        }

        if (payload != null) {
            Object event = payload;
            ok = support.policy().execute(token -> {
                try {
                    return handler.handle(event, token);
                } catch (Exception e) {
                    failure.set(e);
                    throw e;
                }
            });
        }

        if (ok) {
            support.observers().acked(ids, queue);
            getChannel().basicAck(tag, false);
            support.rememberHandled(queue, messageId);
            support.metrics().incConsumeAcked(queue, 1);
        } else {
            reject(tag, messageId, ids, failure.get(), payload == null ? List.of() : List.of(payload));
        }
    }

    private void reject(long tag, String messageId, List<String> ids, Throwable error, List<?> payloads) throws IOException {
        String queue = registration.queueName();
        boolean requeue = support.observers().nacked(ids, queue, error, payloads);
        getChannel().basicReject(tag, requeue);
        support.metrics().incConsumeRejected(queue, 1);
        log.warn("Delivery rejected queue={} messageId={} requeue={}", queue, messageId, requeue);
    }

    public State state() {
        return state;
    }

    @Override
    public String queueName() {
        return registration.queueName();
    }

    @Override
    public boolean isActive() {
        return state == State.CONSUMING;
    }

    @Override
    public void close() {
        Channel channel = getChannel();
        try {
            if (state == State.CONSUMING && getConsumerTag() != null && channel.isOpen()) {
                channel.basicCancel(getConsumerTag());
            }
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (IOException | TimeoutException e) {
            log.warn("Consumer close failed queue={}", registration.queueName(), e);
        }
        state = State.CANCELLED;
    }
}
