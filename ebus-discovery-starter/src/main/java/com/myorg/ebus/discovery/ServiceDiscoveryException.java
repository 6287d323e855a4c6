package com.myorg.ebus.discovery;

// The registry could not be queried.
public class ServiceDiscoveryException extends RuntimeException {
    public ServiceDiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
