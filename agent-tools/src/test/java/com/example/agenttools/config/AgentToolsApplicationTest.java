package com.example.agenttools.config;

import com.example.agenttools.client.BridgeClient;
import com.example.agenttools.client.BridgeClientSettings;
import com.example.agenttools.tools.ToolRegistry;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest(properties = {
        "agent-tools.data-port=1",
        "agent-tools.port-scan-range=1",
        "agent-tools.connect-timeout-ms=300",
        "agent-tools.read-timeout-ms=300",
        "agent-tools.read-retries=0"
})
@DisplayName("Agent tools application context")
class AgentToolsApplicationTest {

    @Autowired
    private BridgeClientSettings settings;

    @Autowired
    private BridgeClient client;

    @Autowired
    private ToolRegistry toolRegistry;

    @Test
    @DisplayName("binds client settings from configuration")
    void bindsSettings() {
        assertEquals(1, settings.dataPort());
        assertEquals(1, settings.portScanRange());
        assertEquals(Duration.ofMillis(300), settings.connectTimeout());
        assertEquals(0, settings.readRetries());
    }

    @Test
    @DisplayName("registers every tool group")
    void registersToolGroups() {
        assertThat(toolRegistry.getAvailableToolIds())
                .containsExactly("data-objects", "flows", "forms", "lookups", "model", "reports");
    }

    @Test
    @DisplayName("tools degrade while the bridge is down")
    void degradesWithoutBridge() {
        String result = toolRegistry.execute(ToolExecutionRequest.builder()
                .id("1").name("get_model_status").arguments("{}").build());

        assertThat(client.isAvailable()).isFalse();
        assertThat(result).contains(BridgeClient.CHANNEL_UNAVAILABLE);
    }
}
