package com.myorg.ebus.rabbitmq.connection;

// The broker could not be reached after reconnect attempts.
public class BrokerUnreachableException extends RuntimeException {
    public BrokerUnreachableException(String message) {
        super(message);
    }

    public BrokerUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
