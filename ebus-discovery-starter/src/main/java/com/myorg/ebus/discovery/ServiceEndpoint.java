package com.myorg.ebus.discovery;

import java.util.List;

public record ServiceEndpoint(String address, int port, List<String> tags) {

    public ServiceEndpoint {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
