package com.myorg.ebus.rabbitmq.consume;

import com.myorg.ebus.eventing.EventBus;
import com.myorg.ebus.eventing.HandlerRegistration;
import com.myorg.ebus.eventing.HandlerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

/**
 * Starts a consumer for every registry entry once the context is refreshed
 * and closes them on shutdown.
 */
@Slf4j
@RequiredArgsConstructor
public class EbusConsumerLifecycle implements SmartLifecycle {

    private final HandlerRegistry registry;
    private final EventBus eventBus;
    private final ConsumerRegistry consumers;
    private final boolean autoStartup;

    private volatile boolean running;

    @Override
    public void start() {
        if (running) return;
        for (HandlerRegistration r : registry.all()) {
            if (consumers.contains(r.queueName())) continue;
            eventBus.register(r);
        }
        running = true;
        log.info("Started {} consumer(s)", consumers.all().size());
    }

    @Override
    public void stop() {
        consumers.close();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    // start after other beans, stop before them
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 100;
    }
}
