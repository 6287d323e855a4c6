package com.myorg.ebus.eventing.resilience;

import com.myorg.ebus.contracts.core.exception.EbusNonRetryableException;
import com.myorg.ebus.eventing.CancellationToken;
import com.myorg.ebus.eventing.EbusEventingProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Fault handling around one subscription's handler calls.
 *
 * <p>Layers, outermost first: fallback to {@code false} &rarr; circuit breaker
 * &rarr; retry &rarr; timeout. {@link #execute(HandlerCall)} never throws.
 * A {@code false} result is a business rejection: it is returned as is and is
 * neither retried nor counted by the breaker. An {@link EbusNonRetryableException}
 * fails the call on the first attempt.
 */
@Slf4j
public class HandlerExecutionPolicy {

    @FunctionalInterface
    public interface HandlerCall {
        boolean call(CancellationToken cancellationToken) throws Exception;
    }

    private final String name;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final ExecutorService executor;

    public HandlerExecutionPolicy(String name, EbusEventingProperties.HandlerPolicy cfg, ExecutorService executor) {
        this.name = name;
        this.executor = executor;

        this.circuitBreaker = CircuitBreaker.of(name, CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.TIME_BASED)
                .slidingWindowSize((int) Math.max(1, cfg.getSlidingWindow().toSeconds()))
                .minimumNumberOfCalls(cfg.getMinimumNumberOfCalls())
                .failureRateThreshold(cfg.getFailureRateThreshold())
                .waitDurationInOpenState(cfg.getOpenStateDuration())
                .permittedNumberOfCallsInHalfOpenState(cfg.getHalfOpenProbes())
                .build());

        this.retry = Retry.of(name, RetryConfig.custom()
                .maxAttempts(cfg.getRetryAttempts())
                .waitDuration(cfg.getRetryWait())
                .ignoreExceptions(EbusNonRetryableException.class)
                .build());

        this.timeLimiter = TimeLimiter.of(name, TimeLimiterConfig.custom()
                .timeoutDuration(cfg.getTimeout())
                .cancelRunningFuture(false)
                .build());

        circuitBreaker.getEventPublisher()
                .onStateTransition(e -> log.warn("Handler circuit {} {}", name, e.getStateTransition()));
        retry.getEventPublisher()
                .onRetry(e -> log.error("Handler attempt {} failed policy={}", e.getNumberOfRetryAttempts(), name, e.getLastThrowable()));
    }

    public boolean execute(HandlerCall call) {
        Callable<Boolean> timed = () -> callWithTimeout(call);
        Callable<Boolean> guarded = CircuitBreaker.decorateCallable(circuitBreaker, Retry.decorateCallable(retry, timed));
        try {
            return Boolean.TRUE.equals(guarded.call());
        } catch (CallNotPermittedException e) {
            log.warn("Handler circuit open policy={}, call rejected", name);
            return false;
        } catch (Exception e) {
            log.error("Handler failed policy={}", name, e);
            return false;
        }
    }

    public CircuitBreaker.State circuitState() {
        return circuitBreaker.getState();
    }

    public String getName() {
        return name;
    }

    private Boolean callWithTimeout(HandlerCall call) throws Exception {
        CancellationToken token = new CancellationToken();
        try {
            return timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(() -> invoke(call, token), executor)
            );
        } catch (TimeoutException e) {
            token.cancel();
            log.warn("Handler timed out after {} policy={}", timeLimiter.getTimeLimiterConfig().getTimeoutDuration(), name);
            throw e;
        }
    }

    private static Boolean invoke(HandlerCall call, CancellationToken token) {
        try {
            return call.call(token);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }
}
