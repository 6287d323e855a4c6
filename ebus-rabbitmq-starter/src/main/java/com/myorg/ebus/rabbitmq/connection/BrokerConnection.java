package com.myorg.ebus.rabbitmq.connection;

import com.rabbitmq.client.Channel;

import java.io.IOException;

/** A broker connection that can be re-established on demand. */
public interface BrokerConnection {

    boolean isConnected();

    /** Connects when not connected; {@code false} when the broker could not be reached. */
    boolean tryConnect();

    Channel createChannel() throws IOException;
}
