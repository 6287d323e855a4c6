package com.myorg.ebus.eventing.resilience;

import com.myorg.ebus.eventing.EbusEventingProperties;
import org.springframework.beans.factory.DisposableBean;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

// Builds one HandlerExecutionPolicy per subscription; owns the threads handler
// bodies run on so a timed-out call can be abandoned.
public class HandlerPolicyFactory implements DisposableBean {

    private final EbusEventingProperties.HandlerPolicy settings;
    private final ExecutorService executor;

    public HandlerPolicyFactory(EbusEventingProperties.HandlerPolicy settings) {
        this.settings = settings;
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ebus-handler-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public HandlerExecutionPolicy create(String name) {
        return new HandlerExecutionPolicy(name, settings, executor);
    }

    @Override
    public void destroy() {
        executor.shutdownNow();
    }
}
