package com.myorg.ebus.eventing.exception;

import com.myorg.ebus.contracts.core.exception.EbusNonRetryableException;

// A subscription was declared without a handler to call.
public class UnknownEventTypeException extends EbusNonRetryableException {
    public UnknownEventTypeException(String queueName) {
        super("UNKNOWN_SUBSCRIPTION", "No handler registered for queue=" + queueName);
    }
}
