package com.myorg.ebus.rabbitmq.publish;

import com.myorg.ebus.contracts.core.conventions.CoreHeaders;
import com.myorg.ebus.contracts.core.event.EventRecord;
import com.myorg.ebus.eventing.EbusEventingProperties;
import com.myorg.ebus.eventing.resilience.ConnectivityRetryPolicy;
import com.myorg.ebus.rabbitmq.EbusRabbitProperties;
import com.myorg.ebus.rabbitmq.connection.BrokerConnection;
import com.myorg.ebus.rabbitmq.connection.ConnectivityFaults;
import com.myorg.ebus.rabbitmq.metrics.EbusRabbitMetrics;
import com.myorg.ebus.rabbitmq.topology.DelayQueueProvisioner;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConfirmCallback;
import com.rabbitmq.client.Return;
import com.rabbitmq.client.ReturnCallback;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doNothing;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PublishPipelineTest {

    private final Channel channel = mock(Channel.class);
    private final BrokerConnection connection = mock(BrokerConnection.class);
    private final Scheduler scheduler = Schedulers.newBoundedElastic(4, 1000, "test-confirm");
    private final AtomicReference<ReturnCallback> returnCallback = new AtomicReference<>();
    private final AtomicReference<ConfirmCallback> ackCallback = new AtomicReference<>();
    private final AtomicReference<ConfirmCallback> nackCallback = new AtomicReference<>();

    private final List<EventRecord> acked = new CopyOnWriteArrayList<>();
    private final List<EventRecord> nacked = new CopyOnWriteArrayList<>();
    private final List<EventRecord> returned = new CopyOnWriteArrayList<>();

    private PublishPipeline pipeline;

    private final EventRecord a = EventRecord.of(1, "A", "{\"n\":1}", "order.placed");
    private final EventRecord b = EventRecord.of(2, "B", "{\"n\":2}", "order.unknown");
    private final EventRecord c = EventRecord.of(3, "C", "{\"n\":3}", "order.placed");

    @BeforeEach
    void setUp() throws Exception {
        when(connection.isConnected()).thenReturn(true);
        when(connection.createChannel()).thenReturn(channel);
        when(channel.isOpen()).thenReturn(true);
        when(channel.getNextPublishSeqNo()).thenReturn(1L, 2L, 3L);
        when(channel.addReturnListener(any(ReturnCallback.class))).thenAnswer(inv -> {
            returnCallback.set(inv.getArgument(0));
            return null;
        });
        when(channel.addConfirmListener(any(ConfirmCallback.class), any(ConfirmCallback.class))).thenAnswer(inv -> {
            ackCallback.set(inv.getArgument(0));
            nackCallback.set(inv.getArgument(1));
            return null;
        });

        EbusRabbitProperties.Publisher settings = new EbusRabbitProperties.Publisher();
        settings.setFlushInterval(Duration.ofMillis(10));
        settings.setDrainTimeout(Duration.ofSeconds(5));
        ConnectivityRetryPolicy retry = new ConnectivityRetryPolicy("test-broker",
                new EbusEventingProperties.ConnectivityRetry(), ConnectivityFaults::isConnectivityFault);

        pipeline = new PublishPipeline(() -> connection, retry, new DelayQueueProvisioner("amq.topic"),
                "amq.topic", settings, scheduler, EbusRabbitMetrics.noop());
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private void publishObserved(List<EventRecord> events, int delaySeconds) {
        pipeline.publish(events, acked::addAll, nacked::addAll, returned::addAll,
                delaySeconds, Duration.ofMillis(500), 500);
    }

    @Test
    void ackedReturnedAndNackedRecordsReachTheirOwnHandler() throws Exception {
        when(channel.waitForConfirms(anyLong())).thenAnswer(inv -> {
            AMQP.BasicProperties propsB = new AMQP.BasicProperties.Builder().messageId("B").build();
            returnCallback.get().handle(new Return(312, "NO_ROUTE", "amq.topic", "order.unknown", propsB, new byte[0]));
            ackCallback.get().handle(2, true);
            nackCallback.get().handle(3, false);
            return false;
        });

        publishObserved(List.of(a, b, c), 0);

        assertThat(acked).containsExactly(a);
        assertThat(returned).containsExactly(b);
        assertThat(nacked).containsExactly(c);
        verify(channel).confirmSelect();
        verify(channel).close();
    }

    @Test
    void publishesMandatoryPersistentMessagesToBusExchange() throws Exception {
        when(channel.waitForConfirms(anyLong())).thenAnswer(inv -> {
            ackCallback.get().handle(3, true);
            return true;
        });
        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);

        boolean ok = pipeline.publish(List.of(a, b, c), 0, Duration.ofMillis(500), 500);

        assertThat(ok).isTrue();
        verify(channel).basicPublish(eq("amq.topic"), eq("order.unknown"), eq(true), any(AMQP.BasicProperties.class), any(byte[].class));
        verify(channel, times(3)).basicPublish(eq("amq.topic"), anyString(), eq(true), props.capture(), any(byte[].class));
        assertThat(props.getAllValues()).extracting(AMQP.BasicProperties::getMessageId).containsExactly("A", "B", "C");
        assertThat(props.getAllValues()).allSatisfy(p -> assertThat(p.getDeliveryMode()).isEqualTo(2));
    }

    @Test
    void unconfirmedRecordsAfterTimeoutFailTheAggregate() throws Exception {
        when(channel.waitForConfirms(anyLong())).thenAnswer(inv -> {
            ackCallback.get().handle(1, false);
            throw new TimeoutException("no confirms");
        });

        publishObserved(List.of(a, b, c), 0);

        assertThat(acked).containsExactly(a);
        assertThat(nacked).containsExactlyInAnyOrder(b, c);
        assertThat(returned).isEmpty();
    }

    @Test
    void aggregateIsFalseWhenAnyRecordWasReturned() throws Exception {
        when(channel.waitForConfirms(anyLong())).thenAnswer(inv -> {
            AMQP.BasicProperties propsB = new AMQP.BasicProperties.Builder().messageId("B").build();
            returnCallback.get().handle(new Return(312, "NO_ROUTE", "amq.topic", "order.unknown", propsB, new byte[0]));
            ackCallback.get().handle(3, true);
            return true;
        });

        assertThat(pipeline.publish(List.of(a, b, c), 0, Duration.ofMillis(500), 500)).isFalse();
    }

    @Test
    void delayedPublishGoesThroughDelayQueueOnDefaultExchange() throws Exception {
        pipeline.publishNonConfirm(List.of(a), 10);

        verify(channel).queueDeclare(eq("order.placed.DELAY.10"), eq(true), eq(false), eq(false), anyMap());
        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(channel).basicPublish(eq(""), eq("order.placed.DELAY.10"), eq(true), props.capture(), any(byte[].class));
        assertThat(props.getValue().getHeaders()).containsEntry(CoreHeaders.EVENT_ID, 1L);
        assertThat(props.getValue().getMessageId()).isEqualTo("A");
    }

    @Test
    void fireAndForgetSwallowsConnectivityFailureAfterRetries() throws Exception {
        when(connection.createChannel()).thenThrow(new IOException("connection refused"));

        assertThatCode(() -> pipeline.publishNonConfirm(List.of(a, b), 0)).doesNotThrowAnyException();

        verify(connection, times(3)).createChannel();
    }

    @Test
    void confirmedPublishWithoutChannelReportsFailure() throws Exception {
        when(connection.createChannel()).thenThrow(new IOException("connection refused"));

        assertThat(pipeline.publish(List.of(a), 0, Duration.ofMillis(100), 10)).isFalse();
    }

    @Test
    void recordsAfterAFailedPublishAreReportedAsNacked() throws Exception {
        doNothing()
                .doThrow(new IllegalStateException("channel in bad state"))
                .when(channel).basicPublish(anyString(), anyString(), eq(true), any(AMQP.BasicProperties.class), any(byte[].class));

        publishObserved(List.of(a, b, c), 0);

        assertThat(acked).isEmpty();
        assertThat(returned).isEmpty();
        assertThat(nacked).containsExactlyInAnyOrder(a, b, c);
        verify(channel).close();
    }

    @Test
    void everyRecordIsNackedWhenNoChannelCanBeOpened() throws Exception {
        when(connection.createChannel()).thenThrow(new IOException("connection refused"));

        publishObserved(List.of(a, b, c), 0);

        assertThat(acked).isEmpty();
        assertThat(returned).isEmpty();
        assertThat(nacked).containsExactlyInAnyOrder(a, b, c);
    }

    @Test
    void emptyInputIsANoOp() {
        assertThat(pipeline.publish(List.of(), 0, Duration.ofMillis(100), 10)).isTrue();
        pipeline.publishNonConfirm(List.of(), 0);
    }
}
