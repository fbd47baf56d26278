package com.scatterbrain.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Creates {@link PlanApiClient}s for the server a command targets.
 */
@Component
public class PlanApiClients {

    private final CliProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    public PlanApiClients(CliProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * @param server explicit base URL, or null for the configured one
     */
    public PlanApiClient connect(String server) {
        String url = server != null && !server.isBlank() ? server : properties.getServer();
        return new PlanApiClient(url, httpClient, objectMapper);
    }
}
