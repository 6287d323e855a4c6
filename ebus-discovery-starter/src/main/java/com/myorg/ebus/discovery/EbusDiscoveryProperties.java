package com.myorg.ebus.discovery;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "ebus.discovery")
public class EbusDiscoveryProperties {
    private boolean enabled = true;
    // Consul agent
    private String address = "localhost";
    private int port = 8500;
    private String datacenter;
    // sent as X-Consul-Token when set
    private String token;
    private Duration timeout = Duration.ofSeconds(5);

    public String baseUrl() {
        return "http://" + address + ":" + port;
    }
}
