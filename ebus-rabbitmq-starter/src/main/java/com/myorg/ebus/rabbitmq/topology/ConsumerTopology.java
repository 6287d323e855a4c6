package com.myorg.ebus.rabbitmq.topology;

import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

// Exchange, queue and binding a consumer registration needs before it consumes.
@Slf4j
public final class ConsumerTopology {

    private ConsumerTopology() {
    }

    public static void declare(Channel channel, String exchange, String exchangeType,
                               String queue, String routeKey, int prefetch) throws IOException {
        channel.exchangeDeclare(exchange, exchangeType, true);
        channel.queueDeclare(queue, true, false, false, null);
        channel.queueBind(queue, exchange, routeKey);
        channel.basicQos(prefetch);
        log.info("Declared queue={} bound to exchange={} routeKey={} prefetch={}", queue, exchange, routeKey, prefetch);
    }
}
