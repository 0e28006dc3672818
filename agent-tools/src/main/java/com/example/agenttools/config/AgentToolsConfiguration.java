package com.example.agenttools.config;

import com.example.agenttools.client.BridgeClient;
import com.example.agenttools.client.BridgeClientSettings;
import com.example.agenttools.tools.DataObjectTools;
import com.example.agenttools.tools.DefaultToolRegistry;
import com.example.agenttools.tools.FlowTools;
import com.example.agenttools.tools.FormTools;
import com.example.agenttools.tools.LookupTools;
import com.example.agenttools.tools.ModelTools;
import com.example.agenttools.tools.ReportTools;
import com.example.agenttools.tools.ToolRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.json.JsonMapper;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
public class AgentToolsConfiguration {

    @Bean
    public JsonMapper jsonMapper() {
        return JsonMapper.builder().build();
    }

    @Bean
    public BridgeClientSettings bridgeClientSettings(
            @Value("${agent-tools.bridge-host:127.0.0.1}") String host,
            @Value("${agent-tools.data-port:3001}") int dataPort,
            @Value("${agent-tools.port-scan-range:10}") int portScanRange,
            @Value("${agent-tools.connect-timeout-ms:2000}") long connectTimeoutMs,
            @Value("${agent-tools.read-timeout-ms:5000}") long readTimeoutMs,
            @Value("${agent-tools.read-retries:1}") int readRetries) {
        return new BridgeClientSettings(host, dataPort, portScanRange,
                Duration.ofMillis(connectTimeoutMs), Duration.ofMillis(readTimeoutMs), readRetries);
    }

    @Bean
    public BridgeClient bridgeClient(BridgeClientSettings settings, JsonMapper jsonMapper) {
        return new BridgeClient(settings, jsonMapper);
    }

    @Bean
    public ToolRegistry toolRegistry(BridgeClient client, JsonMapper jsonMapper) {
        Map<String, Object> tools = new LinkedHashMap<>();
        tools.put("data-objects", new DataObjectTools(client, jsonMapper));
        tools.put("forms", new FormTools(client, jsonMapper));
        tools.put("reports", new ReportTools(client, jsonMapper));
        tools.put("flows", new FlowTools(client, jsonMapper));
        tools.put("lookups", new LookupTools(client, jsonMapper));
        tools.put("model", new ModelTools(client, jsonMapper));
        return new DefaultToolRegistry(tools, jsonMapper);
    }
}
