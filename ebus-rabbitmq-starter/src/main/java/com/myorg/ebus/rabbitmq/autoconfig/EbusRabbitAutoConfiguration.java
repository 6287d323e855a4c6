package com.myorg.ebus.rabbitmq.autoconfig;

import com.myorg.ebus.eventing.EbusEventingProperties;
import com.myorg.ebus.eventing.EventBus;
import com.myorg.ebus.eventing.HandlerRegistry;
import com.myorg.ebus.eventing.PayloadConverter;
import com.myorg.ebus.eventing.autoconfig.EbusEventingAutoConfiguration;
import com.myorg.ebus.eventing.idempotency.IdempotencyCache;
import com.myorg.ebus.eventing.resilience.ConnectivityRetryPolicy;
import com.myorg.ebus.eventing.resilience.HandlerPolicyFactory;
import com.myorg.ebus.rabbitmq.EbusRabbitProperties;
import com.myorg.ebus.rabbitmq.RabbitEventBus;
import com.myorg.ebus.rabbitmq.connection.ConnectionLeaseProvider;
import com.myorg.ebus.rabbitmq.connection.ConnectivityFaults;
import com.myorg.ebus.rabbitmq.connection.RoundRobinConnectionLeaseProvider;
import com.myorg.ebus.rabbitmq.consume.ConsumerRegistry;
import com.myorg.ebus.rabbitmq.consume.EbusConsumerLifecycle;
import com.myorg.ebus.rabbitmq.metrics.EbusRabbitMetrics;
import com.rabbitmq.client.ConnectionFactory;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

@AutoConfiguration(after = EbusEventingAutoConfiguration.class)
@ConditionalOnClass(ConnectionFactory.class)
@EnableConfigurationProperties(EbusRabbitProperties.class)
public class EbusRabbitAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "ebusRabbitConnectionFactory")
    public ConnectionFactory ebusRabbitConnectionFactory(EbusRabbitProperties props) {
        ConnectionFactory f = new ConnectionFactory();
        f.setHost(props.getHost());
        f.setPort(props.getPort());
        f.setVirtualHost(props.getVirtualHost());
        f.setUsername(props.getUsername());
        f.setPassword(props.getPassword());
        f.setConnectionTimeout((int) props.getConnectionTimeout().toMillis());
        f.setAutomaticRecoveryEnabled(true);
        return f;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ConnectionLeaseProvider ebusConnectionLeaseProvider(ConnectionFactory ebusRabbitConnectionFactory,
                                                               EbusRabbitProperties props, Environment env) {
        String app = env.getProperty("spring.application.name", "ebus");
        return new RoundRobinConnectionLeaseProvider(ebusRabbitConnectionFactory, props.getPoolSize(), app);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectivityRetryPolicy ebusConnectivityRetryPolicy(EbusEventingProperties eventing) {
        return new ConnectivityRetryPolicy("ebus-broker", eventing.getConnectivityRetry(),
                ConnectivityFaults::isConnectivityFault);
    }

    @Bean
    @ConditionalOnMissingBean
    public EbusRabbitMetrics ebusRabbitMetrics(ObjectProvider<MeterRegistry> registryProvider, Environment env) {
        MeterRegistry registry = registryProvider.getIfAvailable();
        if (registry == null) return EbusRabbitMetrics.noop();
        EbusRabbitMetrics metrics = new EbusRabbitMetrics(registry, env.getProperty("spring.application.name", "unknown-service"));
        metrics.preRegisterBaseMeters();
        return metrics;
    }

    @Bean
    @ConditionalOnMissingBean
    public ConsumerRegistry ebusConsumerRegistry() {
        return new ConsumerRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(EventBus.class)
    public RabbitEventBus rabbitEventBus(ConnectionLeaseProvider leaseProvider,
                                         ConnectivityRetryPolicy retryPolicy,
                                         HandlerPolicyFactory policyFactory,
                                         PayloadConverter converter,
                                         ObjectProvider<IdempotencyCache> cacheProvider,
                                         EbusEventingProperties eventing,
                                         EbusRabbitProperties props,
                                         EbusRabbitMetrics metrics,
                                         ConsumerRegistry consumers) {
        return new RabbitEventBus(leaseProvider, retryPolicy, policyFactory, converter,
                cacheProvider.getIfAvailable(), eventing.getIdempotency(), props, metrics, consumers);
    }

    @Bean
    @ConditionalOnMissingBean
    public EbusConsumerLifecycle ebusConsumerLifecycle(HandlerRegistry registry, EventBus eventBus,
                                                       ConsumerRegistry consumers, EbusRabbitProperties props) {
        return new EbusConsumerLifecycle(registry, eventBus, consumers, props.getConsumer().isAutoStart());
    }
}
