package com.myorg.ebus.rabbitmq.publish;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maps publisher-confirm sequence numbers back to message ids for one channel.
 *
 * <p>Every tracked id is resolved at most once, by the first signal that covers
 * it: ack, nack, or unconfirmed when {@link #drainUnresolved()} runs. Ids that
 * came back as {@code basic.return} are reported as returned only, never as
 * acked or nacked, even when the broker confirms them afterwards.
 *
 * <p>Broker callbacks arrive on the connection thread; nothing here blocks.
 */
public class ConfirmTracker {

    /** Receives resolutions; implementations must not block. */
    public interface Sink {
        void acked(String messageId);

        void nacked(String messageId);

        void returned(String messageId);
    }

    private final ConcurrentSkipListMap<Long, String> slots = new ConcurrentSkipListMap<>();
    private final Set<String> returned = ConcurrentHashMap.newKeySet();
    private final Set<String> resolved = ConcurrentHashMap.newKeySet();
    // every slot <= this was covered by a cumulative signal
    private final AtomicLong highWaterMark = new AtomicLong(0);
    private final Sink sink;

    public ConfirmTracker(Sink sink) {
        this.sink = sink;
    }

    public void track(long sequenceNumber, String messageId) {
        slots.put(sequenceNumber, messageId);
    }

    public void onReturn(String messageId) {
        if (messageId == null) return;
        if (returned.add(messageId) && resolved.add(messageId)) {
            sink.returned(messageId);
        }
    }

    public void onAck(long deliveryTag, boolean multiple) {
        resolve(deliveryTag, multiple, true);
    }

    public void onNack(long deliveryTag, boolean multiple) {
        resolve(deliveryTag, multiple, false);
    }

    /** Clears every slot no signal reached and returns their ids, excluding returned ones. */
    public List<String> drainUnresolved() {
        List<String> out = new ArrayList<>();
        Map.Entry<Long, String> e;
        while ((e = slots.pollFirstEntry()) != null) {
            String id = e.getValue();
            if (!returned.contains(id) && resolved.add(id)) {
                out.add(id);
            }
        }
        return out;
    }

    /**
     * As {@link #drainUnresolved()}, plus every id of {@code expected} that was
     * never tracked, e.g. records after a failed publish.
     */
    public List<String> drainUnresolved(Collection<String> expected) {
        List<String> out = drainUnresolved();
        for (String id : expected) {
            if (!returned.contains(id) && resolved.add(id)) {
                out.add(id);
            }
        }
        return out;
    }

    public int pending() {
        return slots.size();
    }

    public long highWaterMark() {
        return highWaterMark.get();
    }

    private void resolve(long tag, boolean multiple, boolean ack) {
        if (!multiple) {
            settle(slots.remove(tag), ack);
            return;
        }
        long from = highWaterMark.get();
        if (tag <= from) return;

        ConcurrentNavigableMap<Long, String> covered = slots.subMap(from, false, tag, true);
        for (Long seq : covered.keySet()) {
            settle(slots.remove(seq), ack);
        }
        highWaterMark.accumulateAndGet(tag, Math::max);
    }

    private void settle(String messageId, boolean ack) {
        // null: slot already cleared by an earlier signal
        if (messageId == null || returned.contains(messageId) || !resolved.add(messageId)) return;
        if (ack) {
            sink.acked(messageId);
        } else {
            sink.nacked(messageId);
        }
    }
}
