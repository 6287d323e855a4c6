package com.myorg.ebus.rabbitmq.connection;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Long-lived AMQP connection. Reconnects lazily: callers check
 * {@link #isConnected()} and call {@link #tryConnect()} before use.
 */
@Slf4j
public class PersistentBrokerConnection implements BrokerConnection, AutoCloseable {

    private final ConnectionFactory factory;
    private final String name;
    private volatile Connection connection;
    private volatile boolean closed;

    public PersistentBrokerConnection(ConnectionFactory factory, String name) {
        this.factory = factory;
        this.name = name;
    }

    @Override
    public boolean isConnected() {
        Connection c = connection;
        return c != null && c.isOpen() && !closed;
    }

    @Override
    public synchronized boolean tryConnect() {
        if (closed) return false;
        if (isConnected()) return true;

        try {
            Connection c = factory.newConnection(name);
            c.addShutdownListener(cause -> {
                if (!cause.isInitiatedByApplication()) {
                    log.warn("Broker connection {} shut down: {}", name, cause.getMessage());
                }
            });
            connection = c;
            log.info("Broker connection {} established host={} port={} vhost={}",
                    name, factory.getHost(), factory.getPort(), factory.getVirtualHost());
            return true;
        } catch (IOException | TimeoutException e) {
            log.error("Broker connection {} failed host={} port={}", name, factory.getHost(), factory.getPort(), e);
            return false;
        }
    }

    @Override
    public Channel createChannel() throws IOException {
        if (!isConnected() && !tryConnect()) {
            throw new BrokerUnreachableException("Broker not reachable, connection=" + name);
        }
        Channel channel = connection.createChannel();
        if (channel == null) {
            // channel_max reached
            throw new IOException("No channel available on connection " + name);
        }
        return channel;
    }

    @Override
    public synchronized void close() {
        closed = true;
        Connection c = connection;
        connection = null;
        if (c == null || !c.isOpen()) return;
        try {
            c.close();
            log.info("Broker connection {} closed", name);
        } catch (IOException e) {
            log.warn("Broker connection {} close failed", name, e);
        }
    }
}
