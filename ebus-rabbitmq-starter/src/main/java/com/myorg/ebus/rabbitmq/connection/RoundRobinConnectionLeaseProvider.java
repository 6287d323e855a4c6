package com.myorg.ebus.rabbitmq.connection;

import com.rabbitmq.client.ConnectionFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

// Spreads publishes and registrations over a small pool of persistent connections.
public class RoundRobinConnectionLeaseProvider implements ConnectionLeaseProvider, AutoCloseable {

    private final List<PersistentBrokerConnection> connections;
    private final AtomicInteger next = new AtomicInteger();

    public RoundRobinConnectionLeaseProvider(ConnectionFactory factory, int poolSize, String namePrefix) {
        int size = Math.max(1, poolSize);
        List<PersistentBrokerConnection> list = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            list.add(new PersistentBrokerConnection(factory, namePrefix + "-" + i));
        }
        this.connections = List.copyOf(list);
    }

    @Override
    public BrokerConnection lease() {
        return connections.get(Math.floorMod(next.getAndIncrement(), connections.size()));
    }

    int size() {
        return connections.size();
    }

    @Override
    public void close() {
        connections.forEach(PersistentBrokerConnection::close);
    }
}
