package com.myorg.ebus.rabbitmq.publish;

import com.myorg.ebus.contracts.core.conventions.CoreHeaders;
import com.myorg.ebus.contracts.core.event.EventRecord;
import com.myorg.ebus.eventing.resilience.ConnectivityRetryPolicy;
import com.myorg.ebus.rabbitmq.EbusRabbitProperties;
import com.myorg.ebus.rabbitmq.connection.BrokerConnection;
import com.myorg.ebus.rabbitmq.connection.ConnectionLeaseProvider;
import com.myorg.ebus.rabbitmq.metrics.EbusRabbitMetrics;
import com.myorg.ebus.rabbitmq.topology.DelayQueueProvisioner;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.scheduler.Scheduler;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Publishes event records to the bus exchange, or to a delay queue when a
 * delay is given. All messages are mandatory and persistent and carry the
 * record's message id.
 */
@Slf4j
@RequiredArgsConstructor
public class PublishPipeline {

    private static final int PERSISTENT = 2;

    private final ConnectionLeaseProvider leaseProvider;
    private final ConnectivityRetryPolicy retryPolicy;
    private final DelayQueueProvisioner delayQueues;
    private final String exchange;
    private final EbusRabbitProperties.Publisher settings;
    private final Scheduler scheduler;
    private final EbusRabbitMetrics metrics;

    /** No confirms; failures after retries are logged and dropped. */
    public void publishNonConfirm(List<EventRecord> events, int delaySeconds) {
        if (events == null || events.isEmpty()) return;
        List<PublishEnvelope> envelopes = envelopes(events);

        Channel channel = null;
        try {
            BrokerConnection connection = connected();
            channel = retryPolicy.execute(connection::createChannel);
            Channel ch = channel;
            DelayQueueProvisioner.Session delays = delayQueues.session(ch);
            retryPolicy.run(() -> {
                for (PublishEnvelope env : envelopes) {
                    basicPublish(ch, delays, env, delaySeconds, true);
                }
            });
            log.debug("Published events={} exchange={} delaySeconds={} confirm=false", envelopes.size(), exchange, delaySeconds);
        } catch (Exception e) {
            log.error("Publish failed events={} exchange={} delaySeconds={} confirm=false",
                    envelopes.size(), exchange, delaySeconds, e);
        } finally {
            closeChannel(channel);
        }
    }

    /**
     * Confirmed publish. Returns once every record was reported to exactly one
     * handler (or the drain timeout passed). Records still unconfirmed when
     * {@code timeout} expires go to {@code nackHandler}.
     */
    public void publish(List<EventRecord> events,
                        Consumer<List<EventRecord>> ackHandler,
                        Consumer<List<EventRecord>> nackHandler,
                        Consumer<List<EventRecord>> returnHandler,
                        int delaySeconds, Duration timeout, int batchSize) {
        if (events == null || events.isEmpty()) return;
        List<PublishEnvelope> envelopes = envelopes(events);
        Map<String, EventRecord> byId = index(events);

        AckNackBatcher batcher = new AckNackBatcher(batchSize, settings.getFlushInterval(), scheduler,
                ids -> {
                    metrics.incPublishAcked(ids.size());
                    ackHandler.accept(records(byId, ids));
                },
                ids -> {
                    metrics.incPublishNacked(ids.size());
                    nackHandler.accept(records(byId, ids));
                },
                ids -> {
                    metrics.incPublishReturned(ids.size());
                    returnHandler.accept(records(byId, ids));
                });
        ConfirmTracker tracker = new ConfirmTracker(batcher);

        Channel channel = null;
        try {
            BrokerConnection connection = connected();
            channel = retryPolicy.execute(connection::createChannel);
            Channel ch = channel;
            ch.addReturnListener(r -> {
                String id = r.getProperties() == null ? null : r.getProperties().getMessageId();
                log.warn("Message returned messageId={} exchange={} routeKey={} reply={} {}",
                        id, r.getExchange(), r.getRoutingKey(), r.getReplyCode(), r.getReplyText());
                tracker.onReturn(id);
            });
            ch.addConfirmListener(tracker::onAck, tracker::onNack);
            retryPolicy.run(ch::confirmSelect);

            DelayQueueProvisioner.Session delays = delayQueues.session(ch);
            retryPolicy.run(() -> {
                for (PublishEnvelope env : envelopes) {
                    // record before the publish so an early confirm finds its slot
                    tracker.track(ch.getNextPublishSeqNo(), env.messageId());
                    basicPublish(ch, delays, env, delaySeconds, false);
                }
            });
            awaitConfirms(ch, timeout);
        } catch (Exception e) {
            log.error("Confirmed publish failed events={} exchange={} delaySeconds={}",
                    envelopes.size(), exchange, delaySeconds, e);
        } finally {
            closeChannel(channel);

            // includes records never published when the loop failed partway
            List<String> unresolved = tracker.drainUnresolved(byId.keySet());
            if (!unresolved.isEmpty()) {
                log.warn("No confirm within {} for {} message(s), reporting as nacked", timeout, unresolved.size());
                metrics.incPublishUnconfirmed(unresolved.size());
                unresolved.forEach(batcher::nacked);
            }
            batcher.seal();
            if (!batcher.awaitDrained(settings.getDrainTimeout())) {
                log.warn("Confirm handlers still running after {} events={}", settings.getDrainTimeout(), envelopes.size());
            }
        }
    }

    /** {@code true} only when every record was acked by the broker. */
    public boolean publish(List<EventRecord> events, int delaySeconds, Duration timeout, int batchSize) {
        if (events == null || events.isEmpty()) return true;

        AtomicInteger acked = new AtomicInteger();
        AtomicBoolean failed = new AtomicBoolean();
        publish(events,
                recs -> acked.addAndGet(recs.size()),
                recs -> failed.set(true),
                recs -> failed.set(true),
                delaySeconds, timeout, batchSize);
        return !failed.get() && acked.get() == index(events).size();
    }

    private void awaitConfirms(Channel channel, Duration timeout) throws IOException {
        try {
            if (!channel.waitForConfirms(Math.max(1, timeout.toMillis()))) {
                log.warn("Broker nacked part of the batch exchange={}", exchange);
            }
        } catch (TimeoutException e) {
            // only the wait ends here; the broker keeps the publishes
            log.warn("Confirm wait timed out after {} exchange={}", timeout, exchange);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Confirm wait interrupted exchange={}", exchange);
        }
    }

    private void basicPublish(Channel ch, DelayQueueProvisioner.Session delays, PublishEnvelope env,
                              int delaySeconds, boolean eventIdHeader) throws IOException {
        String targetExchange = exchange;
        String routingKey = env.routeKey();
        if (delaySeconds > 0) {
            routingKey = delays.provision(env.routeKey(), delaySeconds);
            targetExchange = "";
        }

        AMQP.BasicProperties.Builder props = new AMQP.BasicProperties.Builder()
                .deliveryMode(PERSISTENT)
                .messageId(env.messageId());
        if (eventIdHeader) {
            props.headers(Map.<String, Object>of(CoreHeaders.EVENT_ID, env.eventId()));
        }
        ch.basicPublish(targetExchange, routingKey, true, props.build(), env.body());
    }

    private BrokerConnection connected() {
        BrokerConnection connection = leaseProvider.lease();
        if (!connection.isConnected()) {
            connection.tryConnect();
        }
        return connection;
    }

    private static void closeChannel(Channel channel) {
        if (channel == null || !channel.isOpen()) return;
        try {
            channel.close();
        } catch (IOException | TimeoutException e) {
            log.warn("Channel close failed channel={}", channel.getChannelNumber(), e);
        }
    }

    private static List<PublishEnvelope> envelopes(List<EventRecord> events) {
        List<PublishEnvelope> out = new ArrayList<>(events.size());
        for (EventRecord e : events) {
            out.add(PublishEnvelope.from(e));
        }
        return out;
    }

    private static Map<String, EventRecord> index(List<EventRecord> events) {
        Map<String, EventRecord> byId = new LinkedHashMap<>();
        for (EventRecord e : events) {
            byId.putIfAbsent(e.getMessageId(), e);
        }
        return byId;
    }

    private static List<EventRecord> records(Map<String, EventRecord> byId, List<String> ids) {
        List<EventRecord> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            EventRecord r = byId.get(id);
            if (r != null) out.add(r);
        }
        return out;
    }
}
