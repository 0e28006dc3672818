package com.example.agenttools.config;

import com.example.agenttools.tools.ToolRegistry;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs a single tool from the command line: {@code --tool=list_data_objects --args={"isLookup":"true"}}.
 * Without {@code --tool} the available tool groups are logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolCommandRunner implements ApplicationRunner {

    private final ToolRegistry toolRegistry;

    @Override
    public void run(ApplicationArguments args) {
        String tool = firstValue(args, "tool");
        if (tool == null) {
            log.info("Available tool groups: {}", toolRegistry.getAvailableToolIds());
            return;
        }
        String arguments = firstValue(args, "args");
        ToolExecutionRequest request = ToolExecutionRequest.builder()
                .id("cli")
                .name(tool)
                .arguments(arguments != null ? arguments : "{}")
                .build();
        System.out.println(toolRegistry.execute(request));
    }

    private static String firstValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
