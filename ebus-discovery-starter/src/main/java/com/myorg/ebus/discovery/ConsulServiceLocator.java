package com.myorg.ebus.discovery;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Looks up service instances registered with the local Consul agent
 * ({@code GET /v1/agent/services}).
 */
@Slf4j
public class ConsulServiceLocator implements ServiceLocator {

    private static final ParameterizedTypeReference<Map<String, AgentService>> SERVICES =
            new ParameterizedTypeReference<>() { };

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AgentService(
            @JsonProperty("Service") String service,
            @JsonProperty("Tags") List<String> tags,
            @JsonProperty("Address") String address,
            @JsonProperty("Port") int port
    ) {}

    private final RestTemplate restTemplate;
    private final EbusDiscoveryProperties props;

    public ConsulServiceLocator(RestTemplate restTemplate, EbusDiscoveryProperties props) {
        this.restTemplate = restTemplate;
        this.props = props;
    }

    @Override
    public List<ServiceEndpoint> find(String serviceName, String tagFilter) {
        Set<String> wanted = parseTags(tagFilter);
        List<ServiceEndpoint> out = new ArrayList<>();
        for (AgentService s : agentServices().values()) {
            if (s.service() == null || !s.service().equalsIgnoreCase(serviceName)) continue;

            List<String> tags = s.tags() == null ? List.of() : s.tags();
            if (wanted.isEmpty() || tags.stream().anyMatch(wanted::contains)) {
                out.add(new ServiceEndpoint(s.address(), s.port(), tags));
            }
        }
        log.debug("Resolved service={} tags={} endpoints={}", serviceName, wanted, out.size());
        return out;
    }

    private Map<String, AgentService> agentServices() {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(props.baseUrl()).path("/v1/agent/services");
        if (props.getDatacenter() != null && !props.getDatacenter().isBlank()) {
            uri.queryParam("dc", props.getDatacenter());
        }
        HttpHeaders headers = new HttpHeaders();
        if (props.getToken() != null && !props.getToken().isBlank()) {
            headers.set("X-Consul-Token", props.getToken());
        }

        try {
            Map<String, AgentService> body = restTemplate
                    .exchange(uri.toUriString(), HttpMethod.GET, new HttpEntity<>(headers), SERVICES)
                    .getBody();
            return body == null ? Map.of() : body;
        } catch (RestClientException e) {
            throw new ServiceDiscoveryException("Consul agent query failed url=" + props.baseUrl(), e);
        }
    }

    private static Set<String> parseTags(String tagFilter) {
        if (tagFilter == null || tagFilter.isBlank()) return Set.of();
        return Arrays.stream(tagFilter.split(","))
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toSet());
    }
}
