package com.myorg.ebus.rabbitmq.publish;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Groups resolved message ids into chunks and hands each chunk to a callback.
 *
 * <p>{@link #push(String)} never blocks. A chunk holds at most {@code batchSize}
 * ids; a partial chunk is flushed once no id arrived for {@code flushInterval}.
 * Chunks are dispatched with bounded concurrency; a failing callback is logged
 * and the pipeline keeps going.
 */
@Slf4j
public class ConfirmBatchPipeline {

    private final String name;
    private final Sinks.Many<String> input = Sinks.many().unicast().onBackpressureBuffer();
    private final Sinks.Empty<Void> drained = Sinks.empty();

    public ConfirmBatchPipeline(String name, int batchSize, Duration flushInterval,
                                Scheduler scheduler, Consumer<List<String>> callback) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.name = name;
        int concurrency = Math.max(1, Runtime.getRuntime().availableProcessors());

        input.asFlux()
                .bufferTimeout(batchSize, flushInterval, scheduler)
                .flatMap(chunk -> Mono.fromRunnable(() -> dispatch(chunk, callback)).subscribeOn(scheduler), concurrency)
                .subscribe(
                        ignored -> { },
                        e -> {
                            log.error("Confirm pipeline {} terminated", name, e);
                            drained.tryEmitEmpty();
                        },
                        drained::tryEmitEmpty
                );
    }

    public void push(String messageId) {
        // broker callbacks may come from several threads; the sink needs serialized emits
        Sinks.EmitResult result;
        synchronized (input) {
            result = input.tryEmitNext(messageId);
        }
        if (result.isFailure()) {
            log.warn("Confirm pipeline {} dropped messageId={} result={}", name, messageId, result);
        }
    }

    /** No more ids; pending chunks are still dispatched. */
    public void seal() {
        synchronized (input) {
            input.tryEmitComplete();
        }
    }

    public boolean awaitDrained(Duration timeout) {
        try {
            drained.asMono().block(timeout);
            return true;
        } catch (IllegalStateException e) {
            log.warn("Confirm pipeline {} not drained within {}", name, timeout);
            return false;
        }
    }

    private void dispatch(List<String> chunk, Consumer<List<String>> callback) {
        try {
            callback.accept(chunk);
        } catch (Exception e) {
            log.error("Confirm callback failed pipeline={} chunkSize={}", name, chunk.size(), e);
        }
    }
}
