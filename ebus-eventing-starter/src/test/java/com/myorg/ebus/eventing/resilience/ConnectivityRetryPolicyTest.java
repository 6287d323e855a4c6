package com.myorg.ebus.eventing.resilience;

import com.myorg.ebus.eventing.EbusEventingProperties;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectivityRetryPolicyTest {

    private final ConnectivityRetryPolicy policy = new ConnectivityRetryPolicy(
            "broker", new EbusEventingProperties.ConnectivityRetry(), e -> e instanceof IOException);

    @Test
    void retriesConnectivityFaultUntilSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute(() -> {
            if (calls.incrementAndGet() < 3) throw new SocketException("reset");
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    void givesUpAfterConfiguredAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.run(() -> {
            calls.incrementAndGet();
            throw new IOException("connection refused");
        })).isInstanceOf(IOException.class);
        assertThat(calls).hasValue(3);
    }

    @Test
    void otherFaultsAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.run(() -> {
            calls.incrementAndGet();
            throw new IllegalArgumentException("bad routing key");
        })).isInstanceOf(IllegalArgumentException.class);
        assertThat(calls).hasValue(1);
    }
}
