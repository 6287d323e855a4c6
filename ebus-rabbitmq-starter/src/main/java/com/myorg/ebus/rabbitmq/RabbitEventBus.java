package com.myorg.ebus.rabbitmq;

import com.myorg.ebus.contracts.core.event.EventRecord;
import com.myorg.ebus.eventing.AckObserver;
import com.myorg.ebus.eventing.EbusEventingProperties;
import com.myorg.ebus.eventing.EventBus;
import com.myorg.ebus.eventing.HandlerRegistration;
import com.myorg.ebus.eventing.NackObserver;
import com.myorg.ebus.eventing.PayloadConverter;
import com.myorg.ebus.eventing.Subscription;
import com.myorg.ebus.eventing.idempotency.IdempotencyCache;
import com.myorg.ebus.eventing.resilience.ConnectivityRetryPolicy;
import com.myorg.ebus.eventing.resilience.HandlerPolicyFactory;
import com.myorg.ebus.rabbitmq.connection.BrokerConnection;
import com.myorg.ebus.rabbitmq.connection.BrokerUnreachableException;
import com.myorg.ebus.rabbitmq.connection.ConnectionLeaseProvider;
import com.myorg.ebus.rabbitmq.consume.BatchPullConsumer;
import com.myorg.ebus.rabbitmq.consume.ConsumerObservers;
import com.myorg.ebus.rabbitmq.consume.ConsumerRegistry;
import com.myorg.ebus.rabbitmq.consume.ConsumerSupport;
import com.myorg.ebus.rabbitmq.consume.SingleMessageConsumer;
import com.myorg.ebus.rabbitmq.metrics.EbusRabbitMetrics;
import com.myorg.ebus.rabbitmq.publish.PublishPipeline;
import com.myorg.ebus.rabbitmq.topology.DelayQueueProvisioner;
import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * {@link EventBus} over RabbitMQ. Publishes through a {@link PublishPipeline}
 * and starts one consumer per registration, single or batch.
 */
@Slf4j
public class RabbitEventBus implements EventBus, DisposableBean {

    private final ConnectionLeaseProvider leaseProvider;
    private final ConnectivityRetryPolicy retryPolicy;
    private final HandlerPolicyFactory policyFactory;
    private final PayloadConverter converter;
    private final IdempotencyCache idempotencyCache;
    private final EbusEventingProperties.Idempotency idempotency;
    private final EbusRabbitProperties props;
    private final EbusRabbitMetrics metrics;
    private final ConsumerRegistry consumers;
    private final ConsumerObservers observers = new ConsumerObservers();
    private final Scheduler scheduler;
    private final PublishPipeline publisher;

    public RabbitEventBus(ConnectionLeaseProvider leaseProvider,
                          ConnectivityRetryPolicy retryPolicy,
                          HandlerPolicyFactory policyFactory,
                          PayloadConverter converter,
                          IdempotencyCache idempotencyCache,
                          EbusEventingProperties.Idempotency idempotency,
                          EbusRabbitProperties props,
                          EbusRabbitMetrics metrics,
                          ConsumerRegistry consumers) {
        this.leaseProvider = leaseProvider;
        this.retryPolicy = retryPolicy;
        this.policyFactory = policyFactory;
        this.converter = converter;
        this.idempotencyCache = idempotencyCache;
        this.idempotency = idempotency;
        this.props = props;
        this.metrics = metrics;
        this.consumers = consumers;
        this.scheduler = Schedulers.newBoundedElastic(
                Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE, Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "ebus-confirm", 60, true);
        this.publisher = new PublishPipeline(leaseProvider, retryPolicy, new DelayQueueProvisioner(props.getExchange()),
                props.getExchange(), props.getPublisher(), scheduler, metrics);
    }

    @Override
    public void publishNonConfirm(List<EventRecord> events, int delaySeconds) {
        publisher.publishNonConfirm(events, delaySeconds);
    }

    @Override
    public void publish(List<EventRecord> events,
                        Consumer<List<EventRecord>> ackHandler,
                        Consumer<List<EventRecord>> nackHandler,
                        Consumer<List<EventRecord>> returnHandler,
                        int delaySeconds, Duration timeout, int batchSize) {
        publisher.publish(events, ackHandler, nackHandler, returnHandler, delaySeconds, timeout, batchSize);
    }

    @Override
    public boolean publish(List<EventRecord> events, int delaySeconds, Duration timeout, int batchSize) {
        return publisher.publish(events, delaySeconds, timeout, batchSize);
    }

    /** Confirmed publish with the configured timeout and batch size. */
    @Override
    public boolean publish(List<EventRecord> events) {
        EbusRabbitProperties.Publisher p = props.getPublisher();
        return publisher.publish(events, 0, p.getConfirmTimeout(), p.getBatchSize());
    }

    /**
     * Declares the queue and starts consuming.
     *
     * @throws BrokerUnreachableException when the topology could not be declared
     */
    @Override
    public Subscription register(HandlerRegistration registration) {
        String queue = registration.queueName();
        if (consumers.contains(queue)) {
            throw new IllegalStateException("Queue already has a consumer: " + queue);
        }

        BrokerConnection connection = leaseProvider.lease();
        if (!connection.isConnected()) {
            connection.tryConnect();
        }
        ConsumerSupport support = new ConsumerSupport(connection, converter, policyFactory.create(queue),
                idempotencyCache, idempotency, observers, metrics);

        Channel channel = null;
        try {
            channel = retryPolicy.execute(connection::createChannel);
            Subscription subscription;
            if (registration.isBatch()) {
                BatchPullConsumer consumer = new BatchPullConsumer(channel, registration, support,
                        scheduler, props.getConsumer().getBatchIdleInterval(), props.getConsumer().getShutdownTimeout());
                consumer.start(props.getExchange(), props.getExchangeType());
                subscription = consumer;
            } else {
                SingleMessageConsumer consumer = new SingleMessageConsumer(channel, registration, support);
                consumer.start(props.getExchange(), props.getExchangeType(), props.getPrefetch());
                subscription = consumer;
            }
            consumers.add(subscription);
            log.info("Registered queue={} routeKey={} batch={}", queue, registration.eventType(), registration.isBatch());
            return subscription;
        } catch (Exception e) {
            closeQuietly(channel, queue);
            throw new BrokerUnreachableException("Registration failed for queue=" + queue, e);
        }
    }

    @Override
    public RabbitEventBus subscribe(AckObserver ackObserver, NackObserver nackObserver) {
        observers.install(ackObserver, nackObserver);
        return this;
    }

    public ConsumerRegistry consumers() {
        return consumers;
    }

    @Override
    public void destroy() {
        consumers.close();
        scheduler.dispose();
    }

    private static void closeQuietly(Channel channel, String queue) {
        if (channel == null || !channel.isOpen()) return;
        try {
            channel.close();
        } catch (Exception e) {
            log.warn("Closing channel after failed registration failed queue={}", queue, e);
        }
    }
}
