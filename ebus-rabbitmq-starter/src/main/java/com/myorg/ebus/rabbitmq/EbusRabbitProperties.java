package com.myorg.ebus.rabbitmq;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "ebus.rabbitmq")
public class EbusRabbitProperties {
    private String host = "localhost";
    private int port = 5672;
    private String virtualHost = "/";
    private String username = "guest";
    private String password = "guest";
    private Duration connectionTimeout = Duration.ofSeconds(30);
    // AMQP connections leased round-robin
    private int poolSize = 1;

    // events are published to and bound on this exchange
    private String exchange = "amq.topic";
    private String exchangeType = "topic";
    // single-message consumers; batch consumers use their batch size
    private int prefetch = 1;

    private final Publisher publisher = new Publisher();
    private final Consumer consumer = new Consumer();

    @Data
    public static class Publisher {
        private Duration confirmTimeout = Duration.ofMillis(500);
        private int batchSize = 500;
        // a partial confirm chunk is flushed after this idle time
        private Duration flushInterval = Duration.ofMillis(20);
        // max wait for observers after the confirm wait ended
        private Duration drainTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Consumer {
        // start a consumer for every registry entry on startup
        private boolean autoStart = true;
        // batch loop pause after an empty poll or a failed iteration
        private Duration batchIdleInterval = Duration.ofSeconds(1);
        private Duration shutdownTimeout = Duration.ofSeconds(5);
    }
}
