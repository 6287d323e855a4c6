package com.myorg.ebus.eventing;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@NoArgsConstructor
@AllArgsConstructor
@ConfigurationProperties(prefix = "ebus.eventing")
public class EbusEventingProperties {
    // scan @EbusSubscriber beans into the HandlerRegistry
    private boolean scanSubscribers = true;

    private Idempotency idempotency = new Idempotency();
    private HandlerPolicy handlerPolicy = new HandlerPolicy();
    private ConnectivityRetry connectivityRetry = new ConnectivityRetry();

    @Data
    public static class Idempotency {
        private boolean enabled = true;
        /**
         * How long a handled message id is remembered per queue.
         * {@code 0} disables the duplicate check and the cache writes.
         */
        private Duration window = Duration.ofSeconds(15);
        // namespace passed to the cache for every key
        private String namespace = "Events";
        // avoid unbounded memory growth in the in-memory store
        private int maxEntries = 500_000;
        // how often the in-memory store sweeps expired keys
        private Duration cleanupInterval = Duration.ofMinutes(1);

        //auto: Redis when a RedisConnectionFactory exists, otherwise memory
        //redis: Redis required
        //memory: always in-memory
        private String store = "auto";
        private String keyPrefix = "ebus:idemp:";

        // true: store=auto without Redis fails startup
        private boolean requireRedis = false;

        public boolean isActive() {
            return enabled && window != null && !window.isZero() && !window.isNegative();
        }
    }

    @Data
    public static class HandlerPolicy {
        // pessimistic: the caller stops waiting, the handler keeps running
        private Duration timeout = Duration.ofSeconds(2);
        private int retryAttempts = 3;
        private Duration retryWait = Duration.ofMillis(10);

        private float failureRateThreshold = 50f;
        private Duration slidingWindow = Duration.ofSeconds(10);
        private int minimumNumberOfCalls = 8;
        private Duration openStateDuration = Duration.ofSeconds(30);
        private int halfOpenProbes = 1;
    }

    @Data
    public static class ConnectivityRetry {
        // total attempts, first call included
        private int attempts = 3;
        // wait before retry n is baseBackoff * multiplier^(n-1)
        private Duration baseBackoff = Duration.ofMillis(2);
        private double multiplier = 2.0;
    }
}
