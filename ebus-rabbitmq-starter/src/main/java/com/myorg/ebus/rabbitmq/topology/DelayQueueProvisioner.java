package com.myorg.ebus.rabbitmq.topology;

import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Declares the per-(route key, delay) queues used for delayed delivery.
 *
 * <p>A delayed message sits in {@code <routeKey>.DELAY.<seconds>} until its TTL
 * expires, then the broker dead-letters it to the bus exchange with the
 * original route key. Queues expire after ten TTLs without use.
 */
@Slf4j
public class DelayQueueProvisioner {

    private final String deadLetterExchange;

    public DelayQueueProvisioner(String deadLetterExchange) {
        this.deadLetterExchange = deadLetterExchange;
    }

    public static String queueName(String routeKey, int delaySeconds) {
        return routeKey + ".DELAY." + delaySeconds;
    }

    public Map<String, Object> arguments(String routeKey, int delaySeconds) {
        Map<String, Object> args = new HashMap<>();
        args.put("x-expires", delaySeconds * 10_000L);
        args.put("x-message-ttl", delaySeconds * 1_000L);
        args.put("x-dead-letter-exchange", deadLetterExchange);
        args.put("x-dead-letter-routing-key", routeKey);
        return args;
    }

    /** Declarations made through one session are remembered, so each queue is declared once per publish call. */
    public Session session(Channel channel) {
        return new Session(channel);
    }

    public final class Session {
        private final Channel channel;
        private final Set<String> declared = new HashSet<>();

        private Session(Channel channel) {
            this.channel = channel;
        }

        public String provision(String routeKey, int delaySeconds) throws IOException {
            if (delaySeconds <= 0) {
                throw new IllegalArgumentException("delaySeconds must be positive: " + delaySeconds);
            }
            String name = queueName(routeKey, delaySeconds);
            if (declared.add(name)) {
                channel.queueDeclare(name, true, false, false, arguments(routeKey, delaySeconds));
                log.debug("Declared delay queue={} deadLetterExchange={} routeKey={}", name, deadLetterExchange, routeKey);
            }
            return name;
        }
    }
}
