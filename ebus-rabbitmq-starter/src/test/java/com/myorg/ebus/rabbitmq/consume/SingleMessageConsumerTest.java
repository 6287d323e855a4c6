package com.myorg.ebus.rabbitmq.consume;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.ebus.eventing.EbusEventingProperties;
import com.myorg.ebus.eventing.EventHandler;
import com.myorg.ebus.eventing.HandlerRegistration;
import com.myorg.ebus.eventing.JacksonPayloadConverter;
import com.myorg.ebus.eventing.idempotency.IdempotencyCache;
import com.myorg.ebus.eventing.idempotency.InMemoryIdempotencyCache;
import com.myorg.ebus.eventing.resilience.HandlerPolicyFactory;
import com.myorg.ebus.rabbitmq.connection.BrokerConnection;
import com.myorg.ebus.rabbitmq.metrics.EbusRabbitMetrics;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SingleMessageConsumerTest {

    public static class OrderPlaced {
        public String orderId;
    }

    private static final String QUEUE = "orders.queue";

    private final Channel channel = mock(Channel.class);
    private final BrokerConnection connection = mock(BrokerConnection.class);
    private final EbusEventingProperties.Idempotency idempotency = new EbusEventingProperties.Idempotency();
    private final InMemoryIdempotencyCache cache = new InMemoryIdempotencyCache("test", 10_000, Duration.ofMinutes(1));
    private final HandlerPolicyFactory policies = new HandlerPolicyFactory(new EbusEventingProperties.HandlerPolicy());
    private final ConsumerObservers observers = new ConsumerObservers();
    private final List<OrderPlaced> handled = new ArrayList<>();

    @BeforeEach
    void setUp() {
        when(connection.isConnected()).thenReturn(true);
    }

    @AfterEach
    void tearDown() {
        cache.close();
        policies.destroy();
    }

    private SingleMessageConsumer consumer(EventHandler<OrderPlaced> handler) {
        return consumer(handler, cache);
    }

    private SingleMessageConsumer consumer(EventHandler<OrderPlaced> handler, IdempotencyCache cache) {
        HandlerRegistration registration = HandlerRegistration.single(QUEUE, "order.placed", OrderPlaced.class, handler);
        ConsumerSupport support = new ConsumerSupport(connection, new JacksonPayloadConverter(new ObjectMapper()),
                policies.create(QUEUE), cache, idempotency, observers, EbusRabbitMetrics.noop());
        return new SingleMessageConsumer(channel, registration, support);
    }

    private static void deliver(SingleMessageConsumer consumer, long tag, String messageId, String json) {
        AMQP.BasicProperties props = new AMQP.BasicProperties.Builder().messageId(messageId).build();
        consumer.handleDelivery("ctag", new Envelope(tag, false, "amq.topic", "order.placed"), props,
                json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void duplicateDeliveryIsAckedWithoutCallingHandlerAgain() throws Exception {
        SingleMessageConsumer consumer = consumer((e, t) -> handled.add(e));

        deliver(consumer, 1, "m1", "{\"orderId\":\"o-1\"}");
        deliver(consumer, 2, "m1", "{\"orderId\":\"o-1\"}");

        assertThat(handled).hasSize(1);
        verify(channel).basicAck(1, false);
        verify(channel).basicAck(2, false);
        verify(channel, never()).basicReject(anyLong(), anyBoolean());
    }

    @Test
    void ackObserverSeesIdAndQueue() {
        AtomicReference<List<String>> seenIds = new AtomicReference<>();
        AtomicReference<String> seenQueue = new AtomicReference<>();
        observers.install((ids, queue) -> {
            seenIds.set(ids);
            seenQueue.set(queue);
        }, null);
        SingleMessageConsumer consumer = consumer((e, t) -> true);

        deliver(consumer, 7, "m7", "{\"orderId\":\"o-7\"}");

        assertThat(seenIds.get()).containsExactly("m7");
        assertThat(seenQueue.get()).isEqualTo(QUEUE);
    }

    @Test
    void rejectedHandlerRequeuesByDefault() throws Exception {
        SingleMessageConsumer consumer = consumer((e, t) -> false);

        deliver(consumer, 3, "m3", "{\"orderId\":\"o-3\"}");

        verify(channel).basicReject(3, true);
        verify(channel, never()).basicAck(anyLong(), anyBoolean());
        assertThat(cache.exists("orders.queue:m3", "Events")).isFalse();
    }

    @Test
    void nackObserverDecidesRequeue() throws Exception {
        AtomicReference<Throwable> seenError = new AtomicReference<>(new AssertionError("not called"));
        AtomicReference<List<?>> seenPayloads = new AtomicReference<>();
        observers.install(null, (ids, queue, error, payloads) -> {
            seenError.set(error);
            seenPayloads.set(payloads);
            return false;
        });
        SingleMessageConsumer consumer = consumer((e, t) -> false);

        deliver(consumer, 4, "m4", "{\"orderId\":\"o-4\"}");

        verify(channel).basicReject(4, false);
        assertThat(seenError.get()).isNull();
        assertThat(seenPayloads.get()).hasSize(1);
        assertThat(((OrderPlaced) seenPayloads.get().get(0)).orderId).isEqualTo("o-4");
    }

    @Test
    void handlerExceptionIsPassedToNackObserver() throws Exception {
        AtomicReference<Throwable> seenError = new AtomicReference<>();
        observers.install(null, (ids, queue, error, payloads) -> {
            seenError.set(error);
            return true;
        });
        SingleMessageConsumer consumer = consumer((e, t) -> {
            throw new IllegalStateException("inventory down");
        });

        deliver(consumer, 5, "m5", "{\"orderId\":\"o-5\"}");

        verify(channel).basicReject(5, true);
        assertThat(seenError.get()).isInstanceOf(IllegalStateException.class).hasMessage("inventory down");
    }

    @Test
    void undeserializableBodySkipsHandlerAndReportsEmptyPayloads() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AtomicReference<List<?>> seenPayloads = new AtomicReference<>();
        AtomicReference<Throwable> seenError = new AtomicReference<>();
        observers.install(null, (ids, queue, error, payloads) -> {
            seenPayloads.set(payloads);
            seenError.set(error);
            return false;
        });
        SingleMessageConsumer consumer = consumer((e, t) -> calls.incrementAndGet() > 0);

        deliver(consumer, 6, "m6", "{broken");

        assertThat(calls).hasValue(0);
        assertThat(seenPayloads.get()).isEmpty();
        assertThat(seenError.get()).isInstanceOf(IllegalArgumentException.class);
        verify(channel).basicReject(6, false);
    }

    @Test
    void messagesWithoutIdAreNotDeduplicated() throws Exception {
        SingleMessageConsumer consumer = consumer((e, t) -> handled.add(e));

        deliver(consumer, 1, null, "{\"orderId\":\"o-1\"}");
        deliver(consumer, 2, null, "{\"orderId\":\"o-1\"}");

        assertThat(handled).hasSize(2);
        verify(channel).basicAck(2, false);
    }

    @Test
    void zeroWindowDisablesDeduplication() {
        idempotency.setWindow(Duration.ZERO);
        SingleMessageConsumer consumer = consumer((e, t) -> handled.add(e));

        deliver(consumer, 1, "m1", "{\"orderId\":\"o-1\"}");
        deliver(consumer, 2, "m1", "{\"orderId\":\"o-1\"}");

        assertThat(handled).hasSize(2);
    }

    @Test
    void reconnectsBeforeHandlingWhenDisconnected() {
        when(connection.isConnected()).thenReturn(false);
        SingleMessageConsumer consumer = consumer((e, t) -> true);

        deliver(consumer, 1, "m1", "{\"orderId\":\"o-1\"}");

        verify(connection).tryConnect();
    }

    @Test
    void startDeclaresTopologyAndConsumesWithManualAck() throws Exception {
        SingleMessageConsumer consumer = consumer((e, t) -> true);

        consumer.start("amq.topic", "topic", 1);

        verify(channel).exchangeDeclare("amq.topic", "topic", true);
        verify(channel).queueDeclare(QUEUE, true, false, false, null);
        verify(channel).queueBind(QUEUE, "amq.topic", "order.placed");
        verify(channel).basicQos(1);
        verify(channel).basicConsume(QUEUE, false, consumer);
        assertThat(consumer.state()).isEqualTo(SingleMessageConsumer.State.DECLARED);

        consumer.handleConsumeOk("ctag");
        assertThat(consumer.isActive()).isTrue();
        consumer.handleCancel("ctag");
        assertThat(consumer.state()).isEqualTo(SingleMessageConsumer.State.CANCELLED);
    }

    @Test
    void idempotencyLookupFailureRejectsWithObserverDecision() throws Exception {
        IdempotencyCache flaky = mock(IdempotencyCache.class);
        when(flaky.exists(anyString(), anyString())).thenThrow(new IllegalStateException("redis down"));
        AtomicReference<Throwable> seenError = new AtomicReference<>();
        observers.install(null, (ids, queue, error, payloads) -> {
            seenError.set(error);
            return false;
        });
        SingleMessageConsumer consumer = consumer((e, t) -> handled.add(e), flaky);

        deliver(consumer, 1, "m1", "{\"orderId\":\"o-1\"}");

        assertThat(handled).isEmpty();
        assertThat(seenError.get()).hasMessage("redis down");
        verify(channel).basicReject(1, false);
        verify(channel, never()).basicAck(anyLong(), anyBoolean());
    }

    @Test
    void idempotencyLookupFailureRequeuesWithoutObserver() throws Exception {
        IdempotencyCache flaky = mock(IdempotencyCache.class);
        when(flaky.exists(anyString(), anyString())).thenThrow(new IllegalStateException("redis down"));
        SingleMessageConsumer consumer = consumer((e, t) -> handled.add(e), flaky);

        deliver(consumer, 4, "m4", "{\"orderId\":\"o-4\"}");

        verify(channel).basicReject(4, true);
    }

    @Test
    void recoveredConsumerIsActiveAgain() {
        SingleMessageConsumer consumer = consumer((e, t) -> true);
        consumer.handleConsumeOk("ctag");

        consumer.handleShutdownSignal("ctag", new ShutdownSignalException(true, false, null, null));
        assertThat(consumer.isActive()).isFalse();

        consumer.handleRecoverOk("ctag");
        assertThat(consumer.isActive()).isTrue();
        assertThat(consumer.state()).isEqualTo(SingleMessageConsumer.State.CONSUMING);
    }
}
