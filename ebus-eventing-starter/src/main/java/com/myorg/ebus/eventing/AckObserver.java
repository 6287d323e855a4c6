package com.myorg.ebus.eventing;

import java.util.List;

/** Called after a delivery (or batch) was handled successfully, before the broker ack. */
@FunctionalInterface
public interface AckObserver {
    void onAck(List<String> messageIds, String queueName);
}
