package com.myorg.ebus.eventing.resilience;

import com.myorg.ebus.eventing.EbusEventingProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Predicate;

/**
 * Retries broker calls (channel open, confirm select, batched publish) that
 * failed on a connectivity fault, with exponential backoff. Any other
 * exception is rethrown on the first attempt.
 */
@Slf4j
public class ConnectivityRetryPolicy {

    @FunctionalInterface
    public interface BrokerCall<T> {
        T call() throws Exception;
    }

    @FunctionalInterface
    public interface BrokerAction {
        void run() throws Exception;
    }

    private final Retry retry;

    public ConnectivityRetryPolicy(String name, EbusEventingProperties.ConnectivityRetry cfg,
                                   Predicate<Throwable> connectivityFault) {
        this.retry = Retry.of(name, RetryConfig.custom()
                .maxAttempts(Math.max(1, cfg.getAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(cfg.getBaseBackoff(), cfg.getMultiplier()))
                .retryOnException(connectivityFault)
                .build());

        retry.getEventPublisher().onRetry(e -> log.warn("Broker call failed, retry {} in {}ms policy={} error={}",
                e.getNumberOfRetryAttempts(), e.getWaitInterval().toMillis(), name, String.valueOf(e.getLastThrowable())));
    }

    public <T> T execute(BrokerCall<T> call) throws Exception {
        return retry.executeCallable(call::call);
    }

    public void run(BrokerAction action) throws Exception {
        retry.executeCallable(() -> {
            action.run();
            return null;
        });
    }
}
