package com.example.modelbridge.http;

import com.example.modelbridge.BridgeFixture;
import com.example.modelbridge.api.BridgeExceptionHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.server.WebServerException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.client.RestTemplate;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;

import java.net.ServerSocket;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("BridgeChannel")
class BridgeChannelTest {

    private final JsonMapper jsonMapper = BridgeFixture.newJsonMapper();
    private final BridgeExceptionHandler exceptionHandler = new BridgeExceptionHandler(jsonMapper);
    private final RestTemplate rest = TestHttp.restTemplate();
    private BridgeChannel channel;

    @AfterEach
    void tearDown() {
        if (channel != null) {
            channel.stop();
        }
    }

    @RestController
    public static class PingController {

        private final JsonMapper jsonMapper;

        PingController(JsonMapper jsonMapper) {
            this.jsonMapper = jsonMapper;
        }

        @GetMapping("/api/ping")
        public ObjectNode ping(@RequestParam(name = "echo", required = false) String echo) {
            ObjectNode body = jsonMapper.createObjectNode().put("pong", true);
            if (echo != null) {
                body.put("echo", echo);
            }
            return body;
        }

        @GetMapping("/api/fail")
        public ObjectNode fail() {
            throw new IllegalStateException("boom");
        }
    }

    private BridgeChannel newChannel(int preferredPort, int attempts) {
        BridgeSettings settings = new BridgeSettings("127.0.0.1", preferredPort, 0, attempts, Duration.ofMillis(10));
        return new BridgeChannel(ChannelType.DATA, settings, new PingController(jsonMapper), jsonMapper, exceptionHandler);
    }

    private JsonNode get(String path) {
        String body = rest.getForObject("http://127.0.0.1:" + channel.port() + path, String.class);
        return jsonMapper.readTree(body);
    }

    @Test
    @DisplayName("port 0 binds an ephemeral port")
    void ephemeralPort() {
        channel = newChannel(0, 1);

        int port = channel.start();

        assertTrue(port > 0);
        assertTrue(channel.isRunning());
        assertTrue(get("/api/ping").get("pong").asBoolean());
    }

    @Test
    @DisplayName("query parameters are percent-decoded")
    void queryDecoding() {
        channel = newChannel(0, 1);
        channel.start();

        JsonNode body = get("/api/ping?echo=Customer%20Order");

        assertEquals("Customer Order", body.get("echo").asString());
    }

    @Test
    @DisplayName("a busy preferred port moves the channel to the next port")
    void retriesNextPort() throws Exception {
        try (ServerSocket blocker = TestHttp.occupyPortWithFreeSuccessor()) {
            int busy = blocker.getLocalPort();
            channel = newChannel(busy, 3);

            int bound = channel.start();

            assertEquals(busy + 1, bound);
        }
    }

    @Test
    @DisplayName("exhausting the retry range fails startup")
    void retryCeiling() throws Exception {
        try (ServerSocket blocker = TestHttp.occupyPortWithFreeSuccessor()) {
            int busy = blocker.getLocalPort();
            BridgeChannel blocked = newChannel(busy, 1);

            BridgeStartupException ex = assertThrows(BridgeStartupException.class, blocked::start);

            assertEquals(busy, ex.getFirstPort());
            assertEquals(busy, ex.getLastPort());
            assertThat(ex.getCause()).isInstanceOf(WebServerException.class);
            assertFalse(blocked.isRunning());
        }
    }

    @Test
    @DisplayName("a preferred port above 65535 fails startup")
    void portAboveRange() {
        BridgeChannel outOfRange = newChannel(70000, 3);

        BridgeStartupException ex = assertThrows(BridgeStartupException.class, outOfRange::start);

        assertThat(ex.getMessage()).contains("70000");
        assertFalse(outOfRange.isRunning());
    }

    @Test
    @DisplayName("unknown paths get a JSON 404 envelope")
    void unknownRoute() {
        channel = newChannel(0, 1);
        channel.start();

        ResponseEntity<String> response = rest.getForEntity("http://127.0.0.1:" + channel.port() + "/api/nothing", String.class);

        assertEquals(404, response.getStatusCode().value());
        JsonNode body = jsonMapper.readTree(response.getBody());
        assertFalse(body.get("success").asBoolean());
        assertEquals("not_found", body.get("error").asString());
    }

    @Test
    @DisplayName("handler failures become a 500 envelope")
    void handlerFailure() {
        channel = newChannel(0, 1);
        channel.start();

        ResponseEntity<String> response = rest.getForEntity("http://127.0.0.1:" + channel.port() + "/api/fail", String.class);

        assertEquals(500, response.getStatusCode().value());
        assertEquals("internal", jsonMapper.readTree(response.getBody()).get("error").asString());
    }

    @Test
    @DisplayName("preflight requests are answered with CORS headers")
    void preflight() {
        channel = newChannel(0, 1);
        channel.start();

        HttpHeaders headers = new HttpHeaders();
        headers.setOrigin("http://localhost:5173");
        headers.setAccessControlRequestMethod(HttpMethod.GET);
        ResponseEntity<String> response = rest.exchange("http://127.0.0.1:" + channel.port() + "/api/ping",
                HttpMethod.OPTIONS, new HttpEntity<>(headers), String.class);

        assertEquals(200, response.getStatusCode().value());
        assertEquals("*", response.getHeaders().getFirst("Access-Control-Allow-Origin"));
    }

    @Test
    @DisplayName("stop releases the port")
    void stop() {
        channel = newChannel(0, 1);
        channel.start();

        channel.stop();

        assertEquals(-1, channel.port());
        assertFalse(channel.isRunning());
    }
}
