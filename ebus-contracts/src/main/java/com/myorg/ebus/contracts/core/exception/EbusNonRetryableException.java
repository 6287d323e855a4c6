package com.myorg.ebus.contracts.core.exception;

public class EbusNonRetryableException extends RuntimeException {

    private final String reason;

    public EbusNonRetryableException(String message) {
        this("NON_RETRYABLE", message);
    }

    public EbusNonRetryableException(String reason, String message) {
        super(message);
        this.reason = (reason == null || reason.isBlank()) ? "NON_RETRYABLE" : reason;
    }

    public String getReason() {
        return reason;
    }
}
