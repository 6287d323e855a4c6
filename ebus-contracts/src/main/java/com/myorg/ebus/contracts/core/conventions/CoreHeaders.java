package com.myorg.ebus.contracts.core.conventions;

public final class CoreHeaders {
    private CoreHeaders() {}

    /** Numeric event-log id, set on fire-and-forget publishes. */
    public static final String EVENT_ID = "EventId";
}
