package com.example.agenttools.client;

import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

import java.net.URI;
import java.net.http.HttpClient;

/**
 * Blocking JSON calls with fixed timeouts. Any status is returned to the caller; connection
 * failures, timeouts and bodies that are not JSON raise {@link BridgeUnavailableException}.
 */
public class BridgeTransport {

    private final RestClient restClient;
    private final JsonMapper jsonMapper;

    public BridgeTransport(BridgeClientSettings settings, JsonMapper jsonMapper) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(settings.connectTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(settings.readTimeout());
        this.restClient = RestClient.builder().requestFactory(requestFactory).build();
        this.jsonMapper = jsonMapper;
    }

    public BridgeReply get(String url) {
        try {
            ResponseEntity<String> response = restClient.get()
                    .uri(URI.create(url))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(BridgeTransport::anyStatus, (request, reply) -> {
                    })
                    .toEntity(String.class);
            return toReply(url, response);
        } catch (RestClientException e) {
            throw new BridgeUnavailableException("GET " + url + " failed: " + e.getMessage(), e);
        }
    }

    public BridgeReply post(String url, JsonNode body) {
        try {
            ResponseEntity<String> response = restClient.post()
                    .uri(URI.create(url))
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(jsonMapper.writeValueAsString(body))
                    .retrieve()
                    .onStatus(BridgeTransport::anyStatus, (request, reply) -> {
                    })
                    .toEntity(String.class);
            return toReply(url, response);
        } catch (RestClientException e) {
            throw new BridgeUnavailableException("POST " + url + " failed: " + e.getMessage(), e);
        }
    }

    private BridgeReply toReply(String url, ResponseEntity<String> response) {
        String text = response.getBody();
        if (text == null || text.isBlank()) {
            throw new BridgeUnavailableException("Empty response from " + url);
        }
        try {
            return new BridgeReply(response.getStatusCode().value(), jsonMapper.readTree(text));
        } catch (JacksonException e) {
            throw new BridgeUnavailableException("Response from " + url + " is not JSON", e);
        }
    }

    private static boolean anyStatus(HttpStatusCode status) {
        return true;
    }
}
