package com.myorg.ebus.rabbitmq.consume;

import com.myorg.ebus.eventing.BatchEventHandler;
import com.myorg.ebus.eventing.HandlerRegistration;
import com.myorg.ebus.eventing.Subscription;
import com.myorg.ebus.rabbitmq.support.EbusMdc;
import com.myorg.ebus.rabbitmq.topology.ConsumerTopology;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.GetResponse;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pull consumer that hands the handler a whole batch per iteration.
 *
 * <p>One background thread loops: pull up to {@code batchSize} deliveries,
 * drop duplicates and unreadable ones, run the handler on the rest, then ack
 * or nack cumulatively up to the highest admitted delivery tag. A failed
 * iteration nacks whatever it pulled and had not settled, is logged, and the
 * loop continues; it stops only on {@link #close()}.
 */
@Slf4j
public class BatchPullConsumer implements Subscription {

    private static final int ADMISSION_CONCURRENCY = Math.max(1, Runtime.getRuntime().availableProcessors());

    private record Admitted(String messageId, Object payload) {}

    private record Faulted(String messageId, RuntimeException error) {}

    private final Channel channel;
    private final HandlerRegistration registration;
    private final ConsumerSupport support;
    private final BatchEventHandler<Object> handler;
    private final Scheduler admissionScheduler;
    private final Duration idleInterval;
    private final Duration shutdownTimeout;
    // basicGet / ack / nack from the loop and the admission workers
    private final Object channelLock = new Object();

    private volatile boolean running;
    private Thread worker;

    @SuppressWarnings("unchecked")
    public BatchPullConsumer(Channel channel, HandlerRegistration registration, ConsumerSupport support,
                             Scheduler admissionScheduler, Duration idleInterval, Duration shutdownTimeout) {
        if (!registration.isBatch()) {
            throw new IllegalArgumentException("Single registration given to batch consumer, queue=" + registration.queueName());
        }
        this.channel = channel;
        this.registration = registration;
        this.support = support;
        this.handler = (BatchEventHandler<Object>) registration.batchHandler();
        this.admissionScheduler = admissionScheduler;
        this.idleInterval = idleInterval;
        this.shutdownTimeout = shutdownTimeout;
    }

    public synchronized void start(String exchange, String exchangeType) throws IOException {
        if (running) return;
        ConsumerTopology.declare(channel, exchange, exchangeType,
                registration.queueName(), registration.eventType(), registration.batchSize());
        support.metrics().preRegisterQueue(registration.queueName());

        running = true;
        worker = new Thread(this::loop, "ebus-batch-" + registration.queueName());
        worker.setDaemon(true);
        worker.start();
        log.info("Batch consumer started queue={} batchSize={}", registration.queueName(), registration.batchSize());
    }

    private void loop() {
        while (running) {
            boolean worked;
            try {
                worked = pollOnce();
            } catch (Exception e) {
                if (!running) break;
                log.error("Batch iteration failed queue={}", registration.queueName(), e);
                worked = false;
            }
            if (!worked && running) {
                pause();
            }
        }
        log.info("Batch consumer stopped queue={}", registration.queueName());
    }

    /**
     * One iteration.
     *
     * @return {@code false} when the queue was empty
     */
    boolean pollOnce() throws IOException {
        String queue = registration.queueName();
        support.ensureConnected();

        List<GetResponse> pulled = new ArrayList<>();
        for (int i = 0; i < registration.batchSize(); i++) {
            GetResponse r;
            synchronized (channelLock) {
                r = channel.basicGet(queue, false);
            }
            if (r == null) break;
            pulled.add(r);
        }
        if (pulled.isEmpty()) return false;

        Set<Long> settled = ConcurrentHashMap.newKeySet();
        try {
            process(queue, pulled, settled);
        } catch (IOException | RuntimeException e) {
            releaseUnsettled(queue, pulled, settled, e);
            throw e;
        }
        return true;
    }

    private void process(String queue, List<GetResponse> pulled, Set<Long> settled) throws IOException {
        // id checks in delivery order, so the first copy of a duplicate wins
        List<GetResponse> candidates = new ArrayList<>(pulled.size());
        Set<String> seen = new HashSet<>();
        for (GetResponse r : pulled) {
            long tag = r.getEnvelope().getDeliveryTag();
            String messageId = r.getProps() == null ? null : r.getProps().getMessageId();
            if (messageId == null || messageId.isBlank()) {
                discard(tag, messageId, "missing message id", settled);
            } else if (!seen.add(messageId)) {
                support.metrics().incConsumeDuplicate(queue);
                discard(tag, messageId, "duplicate", settled);
            } else {
                candidates.add(r);
            }
        }

        ConcurrentSkipListMap<Long, Admitted> pool = new ConcurrentSkipListMap<>();
        ConcurrentSkipListMap<Long, Faulted> faults = new ConcurrentSkipListMap<>();
        Flux.fromIterable(candidates)
                .flatMap(r -> Mono.fromRunnable(() -> admit(r, pool, faults, settled)).subscribeOn(admissionScheduler),
                        ADMISSION_CONCURRENCY)
                .blockLast();

        // before the cumulative ack, which would cover these tags too
        if (!faults.isEmpty()) {
            rejectFaulted(queue, faults, settled);
        }
        if (pool.isEmpty()) return;
        handle(queue, pool, settled);
    }

    // cache lookup and deserialization, run concurrently per delivery
    private void admit(GetResponse r, ConcurrentSkipListMap<Long, Admitted> pool,
                       ConcurrentSkipListMap<Long, Faulted> faults, Set<Long> settled) {
        long tag = r.getEnvelope().getDeliveryTag();
        String messageId = r.getProps().getMessageId();
        String queue = registration.queueName();
        EbusMdc.put(queue, messageId, r.getEnvelope().getRoutingKey());
        try {
            boolean handled;
            try {
                handled = support.alreadyHandled(queue, messageId);
            } catch (RuntimeException e) {
                log.warn("Idempotency lookup failed queue={} messageId={}", queue, messageId, e);
                faults.put(tag, new Faulted(messageId, e));
                return;
            }
            if (handled) {
                support.metrics().incConsumeDuplicate(queue);
                discard(tag, messageId, "already handled", settled);
                return;
            }
            Object payload;
            try {
                payload = support.converter().read(r.getBody(), registration.payloadType());
            } catch (RuntimeException e) {
                log.warn("Undeserializable delivery queue={} messageId={} type={}",
                        queue, messageId, registration.payloadType().getName(), e);
                discard(tag, messageId, "undeserializable", settled);
                return;
            }
            pool.put(tag, new Admitted(messageId, payload));
        } finally {
            EbusMdc.clear();
        }
    }

    private void discard(long tag, String messageId, String reason, Set<Long> settled) {
        try {
            synchronized (channelLock) {
                channel.basicNack(tag, false, false);
            }
            settled.add(tag);
            log.debug("Discarded delivery queue={} messageId={} deliveryTag={} reason={}",
                    registration.queueName(), messageId, tag, reason);
        } catch (IOException e) {
            log.error("Discard failed queue={} messageId={} deliveryTag={}", registration.queueName(), messageId, tag, e);
        }
    }

    private void rejectFaulted(String queue, ConcurrentSkipListMap<Long, Faulted> faults, Set<Long> settled) throws IOException {
        List<String> ids = new ArrayList<>(faults.size());
        for (Faulted f : faults.values()) {
            ids.add(f.messageId());
        }
        boolean requeue = support.observers().nacked(ids, queue, faults.firstEntry().getValue().error(), List.of());
        for (Long tag : faults.keySet()) {
            synchronized (channelLock) {
                channel.basicNack(tag, false, requeue);
            }
            settled.add(tag);
        }
        support.metrics().incConsumeRejected(queue, ids.size());
        log.warn("Deliveries nacked after idempotency lookup failure queue={} size={} requeue={}", queue, ids.size(), requeue);
    }

    // a failed iteration must not leave pulled deliveries unacked on the channel
    private void releaseUnsettled(String queue, List<GetResponse> pulled, Set<Long> settled, Exception cause) {
        List<Long> tags = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        for (GetResponse r : pulled) {
            long tag = r.getEnvelope().getDeliveryTag();
            if (settled.contains(tag)) continue;
            tags.add(tag);
            ids.add(r.getProps() == null ? null : r.getProps().getMessageId());
        }
        if (tags.isEmpty()) return;

        boolean requeue = support.observers().nacked(ids, queue, cause, List.of());
        for (Long tag : tags) {
            try {
                synchronized (channelLock) {
                    channel.basicNack(tag, false, requeue);
                }
            } catch (IOException | RuntimeException e) {
                log.error("Release failed queue={} deliveryTag={}", queue, tag, e);
            }
        }
        support.metrics().incConsumeRejected(queue, tags.size());
        log.warn("Released deliveries after failed iteration queue={} size={} requeue={}", queue, tags.size(), requeue);
    }

    private void handle(String queue, ConcurrentSkipListMap<Long, Admitted> pool, Set<Long> settled) throws IOException {
        long highestTag = pool.lastKey();
        List<String> ids = new ArrayList<>(pool.size());
        List<Object> payloads = new ArrayList<>(pool.size());
        for (Admitted a : pool.values()) {
            ids.add(a.messageId());
            payloads.add(a.payload());
        }

        AtomicReference<Throwable> failure = new AtomicReference<>();
        boolean ok = support.policy().execute(token -> {
            try {
                return handler.handle(payloads, token);
            } catch (Exception e) {
                failure.set(e);
                throw e;
            }
        });

        if (ok) {
            support.observers().acked(ids, queue);
            synchronized (channelLock) {
                channel.basicAck(highestTag, true);
            }
            settled.addAll(pool.keySet());
            for (String id : ids) {
                support.rememberHandled(queue, id);
            }
            support.metrics().incConsumeAcked(queue, ids.size());
            log.debug("Batch acked queue={} size={} upToTag={}", queue, ids.size(), highestTag);
        } else {
            boolean requeue = support.observers().nacked(ids, queue, failure.get(), payloads);
            synchronized (channelLock) {
                channel.basicNack(highestTag, true, requeue);
            }
            settled.addAll(pool.keySet());
            support.metrics().incConsumeRejected(queue, ids.size());
            log.warn("Batch nacked queue={} size={} upToTag={} requeue={}", queue, ids.size(), highestTag, requeue);
        }
    }

    private void pause() {
        try {
            Thread.sleep(Math.max(1, idleInterval.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    @Override
    public String queueName() {
        return registration.queueName();
    }

    @Override
    public boolean isActive() {
        return running;
    }

    @Override
    public void close() {
        Thread t;
        synchronized (this) {
            running = false;
            t = worker;
            worker = null;
        }
        if (t != null) {
            t.interrupt();
            try {
                t.join(Math.max(1, shutdownTimeout.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (IOException | TimeoutException e) {
            log.warn("Batch consumer close failed queue={}", registration.queueName(), e);
        }
    }
}
