package com.example.modelbridge.http;

import com.example.modelbridge.api.BadRequestException;
import com.example.modelbridge.command.CommandDispatcher;
import com.example.modelbridge.command.CommandResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

/**
 * Endpoints of the command channel: health, the command catalogue and command execution.
 * <p>
 * POST /api/execute-command takes {@code {"command": "...", "args": {...}}}. The body is read as
 * text so that malformed JSON is reported as {@code bad_request} in the usual envelope.
 * </p>
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class CommandChannelController {

    private final CommandDispatcher dispatcher;
    private final BridgeHealth health;
    private final BridgeEventLoop eventLoop;
    private final JsonMapper jsonMapper;

    public CommandChannelController(CommandDispatcher dispatcher, BridgeHealth health, BridgeEventLoop eventLoop,
                                    JsonMapper jsonMapper) {
        this.dispatcher = dispatcher;
        this.health = health;
        this.eventLoop = eventLoop;
        this.jsonMapper = jsonMapper;
    }

    @GetMapping("/health")
    public ResponseEntity<JsonNode> health() {
        log.trace("Command channel health check");
        return ResponseEntity.ok(eventLoop.call(() -> health.report(ChannelType.COMMAND)));
    }

    @GetMapping("/commands")
    public ResponseEntity<JsonNode> commands() {
        return ResponseEntity.ok(dispatcher.catalogue());
    }

    @PostMapping("/execute-command")
    public ResponseEntity<JsonNode> execute(@RequestBody(required = false) String body) {
        JsonNode request = parseBody(body);
        JsonNode command = request.get("command");
        if (command == null || !command.isString() || command.stringValue().isBlank()) {
            throw new BadRequestException("Request body must contain a 'command' string");
        }
        CommandResult result = eventLoop.call(() -> dispatcher.execute(command.stringValue(), request.get("args")));
        return ResponseEntity.status(result.status()).body(result.body());
    }

    private JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) {
            throw new BadRequestException("Request body is empty; expected {\"command\": ..., \"args\": {...}}");
        }
        JsonNode json;
        try {
            json = jsonMapper.readTree(body);
        } catch (JacksonException e) {
            throw new BadRequestException("Request body is not valid JSON");
        }
        if (json == null || !json.isObject()) {
            throw new BadRequestException("Request body must be a JSON object");
        }
        return json;
    }
}
