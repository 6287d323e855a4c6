package com.myorg.ebus.rabbitmq.publish;

import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

// One pipeline per outcome; fed by the ConfirmTracker of a single publish call.
public class AckNackBatcher implements ConfirmTracker.Sink {

    private final ConfirmBatchPipeline ackPipeline;
    private final ConfirmBatchPipeline nackPipeline;
    private final ConfirmBatchPipeline returnPipeline;

    public AckNackBatcher(int batchSize, Duration flushInterval, Scheduler scheduler,
                          Consumer<List<String>> onAcked,
                          Consumer<List<String>> onNacked,
                          Consumer<List<String>> onReturned) {
        this.ackPipeline = new ConfirmBatchPipeline("ack", batchSize, flushInterval, scheduler, onAcked);
        this.nackPipeline = new ConfirmBatchPipeline("nack", batchSize, flushInterval, scheduler, onNacked);
        this.returnPipeline = new ConfirmBatchPipeline("return", batchSize, flushInterval, scheduler, onReturned);
    }

    @Override
    public void acked(String messageId) {
        ackPipeline.push(messageId);
    }

    @Override
    public void nacked(String messageId) {
        nackPipeline.push(messageId);
    }

    @Override
    public void returned(String messageId) {
        returnPipeline.push(messageId);
    }

    public void seal() {
        ackPipeline.seal();
        nackPipeline.seal();
        returnPipeline.seal();
    }

    /** Waits for all three pipelines, sharing one deadline. */
    public boolean awaitDrained(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean drained = true;
        for (ConfirmBatchPipeline p : List.of(ackPipeline, nackPipeline, returnPipeline)) {
            Duration left = Duration.ofNanos(Math.max(1, deadline - System.nanoTime()));
            drained &= p.awaitDrained(left);
        }
        return drained;
    }
}
