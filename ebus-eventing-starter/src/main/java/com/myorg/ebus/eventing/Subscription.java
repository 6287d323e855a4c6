package com.myorg.ebus.eventing;

/** Handle of a running queue subscription. */
public interface Subscription extends AutoCloseable {

    String queueName();

    boolean isActive();

    @Override
    void close();
}
