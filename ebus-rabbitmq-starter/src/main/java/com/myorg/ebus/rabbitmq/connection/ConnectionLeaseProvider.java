package com.myorg.ebus.rabbitmq.connection;

public interface ConnectionLeaseProvider {
    BrokerConnection lease();
}
