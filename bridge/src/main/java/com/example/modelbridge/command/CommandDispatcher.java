package com.example.modelbridge.command;

import com.example.modelbridge.api.BridgeException;
import com.example.modelbridge.api.BridgeExceptionHandler;
import com.example.modelbridge.api.UnknownCommandException;
import com.example.modelbridge.validation.MutationValidationException;
import com.example.modelbridge.validation.ValidationError;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.metadata.PropertyDescriptor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.BeanProperty;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.jsonFormatVisitors.JsonFormatVisitorWrapper;
import tools.jackson.databind.jsonFormatVisitors.JsonObjectFormatVisitor;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes a command name and its arguments to the registered handler.
 * <p>
 * Arguments are bound to the command's record type and checked with Bean Validation before the
 * handler runs. Every outcome, including failures, is returned as an envelope; nothing escapes.
 * </p>
 */
@Slf4j
public class CommandDispatcher {

    private static final Set<Class<?>> REQUIRED_CONSTRAINTS = Set.of(NotBlank.class, NotNull.class, NotEmpty.class);

    private final JsonMapper jsonMapper;
    private final Validator validator;
    private final BridgeExceptionHandler exceptionHandler;
    private final Map<String, CommandDefinition<?>> commands = new LinkedHashMap<>();
    private final Map<Class<?>, ArgumentShape> shapes = new ConcurrentHashMap<>();

    public CommandDispatcher(JsonMapper jsonMapper, Validator validator, BridgeExceptionHandler exceptionHandler,
                             List<? extends CommandGroup> groups) {
        this.jsonMapper = jsonMapper;
        this.validator = validator;
        this.exceptionHandler = exceptionHandler;
        for (CommandGroup group : groups) {
            for (CommandDefinition<?> definition : group.commands()) {
                if (commands.putIfAbsent(definition.name(), definition) != null) {
                    throw new IllegalStateException("Duplicate command: " + definition.name());
                }
            }
        }
        log.info("Registered {} commands", commands.size());
    }

    public CommandResult execute(String commandName, JsonNode arguments) {
        try {
            CommandDefinition<?> definition = commands.get(commandName);
            if (definition == null) {
                throw new UnknownCommandException(commandName);
            }
            log.debug("Executing command={}", commandName);
            ObjectNode payload = invoke(definition, arguments);
            return new CommandResult(null, exceptionHandler.success(payload));
        } catch (UnknownCommandException ex) {
            BridgeExceptionHandler.ErrorReply reply = exceptionHandler.handle(ex);
            ArrayNode available = reply.body().putArray("availableCommands");
            commands.keySet().forEach(available::add);
            return new CommandResult(reply.code(), reply.body());
        } catch (BridgeException ex) {
            return toResult(exceptionHandler.handle(ex));
        } catch (IllegalArgumentException ex) {
            return toResult(exceptionHandler.invalidArgument(ex));
        } catch (RuntimeException ex) {
            return toResult(exceptionHandler.internal(ex));
        }
    }

    List<CommandDefinition<?>> definitions() {
        return List.copyOf(commands.values());
    }

    /**
     * The catalogue served by {@code GET /api/commands}: name, description, mutating flag and arguments.
     */
    public ArrayNode catalogue() {
        ArrayNode catalogue = jsonMapper.createArrayNode();
        for (CommandDefinition<?> definition : commands.values()) {
            ObjectNode entry = catalogue.addObject();
            entry.put("name", definition.name());
            entry.put("description", definition.description());
            entry.put("mutating", definition.mutating());
            ArrayNode arguments = entry.putArray("arguments");
            ArgumentShape shape = shapeOf(definition.argumentsType());
            shape.jsonNames().forEach((property, jsonName) -> arguments.addObject()
                    .put("name", definition.label(jsonName))
                    .put("required", shape.required().contains(property)));
        }
        return catalogue;
    }

    private <A> ObjectNode invoke(CommandDefinition<A> definition, JsonNode arguments) {
        A bound = bind(definition, arguments);
        return definition.handler().handle(bound);
    }

    private <A> A bind(CommandDefinition<A> definition, JsonNode arguments) {
        JsonNode source = arguments == null || arguments.isNull() || arguments.isMissingNode()
                ? jsonMapper.createObjectNode()
                : arguments;
        if (!source.isObject()) {
            throw new MutationValidationException("args", "args must be a JSON object");
        }
        A bound;
        try {
            bound = jsonMapper.treeToValue(source, definition.argumentsType());
        } catch (JacksonException e) {
            throw new MutationValidationException("args", "invalid arguments: " + firstLine(e.getMessage()));
        }
        Set<ConstraintViolation<A>> violations = validator.validate(bound);
        if (!violations.isEmpty()) {
            List<ValidationError> errors = new ArrayList<>();
            for (ConstraintViolation<A> violation : violations) {
                String property = violation.getPropertyPath().toString();
                String argument = definition.label(shapeOf(definition.argumentsType()).jsonName(property));
                errors.add(new ValidationError(argument, argument + " " + violation.getMessage()));
            }
            errors.sort(Comparator.comparing(ValidationError::field));
            throw new MutationValidationException(errors);
        }
        return bound;
    }

    private CommandResult toResult(BridgeExceptionHandler.ErrorReply reply) {
        return new CommandResult(reply.code(), reply.body());
    }

    private ArgumentShape shapeOf(Class<?> type) {
        return shapes.computeIfAbsent(type, this::introspect);
    }

    /**
     * Argument names as Jackson reads and writes them, keyed by record component, plus the
     * components Bean Validation treats as mandatory.
     */
    private ArgumentShape introspect(Class<?> type) {
        Map<String, String> jsonNames = new LinkedHashMap<>();
        jsonMapper.acceptJsonFormatVisitor(jsonMapper.constructType(type), new JsonFormatVisitorWrapper.Base() {
            @Override
            public JsonObjectFormatVisitor expectObjectFormat(JavaType javaType) {
                return new JsonObjectFormatVisitor.Base() {
                    @Override
                    public void property(BeanProperty property) {
                        collect(property);
                    }

                    @Override
                    public void optionalProperty(BeanProperty property) {
                        collect(property);
                    }

                    private void collect(BeanProperty property) {
                        String component = property.getMember() != null ? property.getMember().getName() : property.getName();
                        jsonNames.put(component, property.getName());
                    }
                };
            }
        });
        Set<String> required = new HashSet<>();
        for (PropertyDescriptor property : validator.getConstraintsForClass(type).getConstrainedProperties()) {
            boolean mandatory = property.getConstraintDescriptors().stream()
                    .anyMatch(constraint -> REQUIRED_CONSTRAINTS.contains(constraint.getAnnotation().annotationType()));
            if (mandatory) {
                required.add(property.getPropertyName());
            }
        }
        return new ArgumentShape(jsonNames, required);
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unreadable value";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    private record ArgumentShape(Map<String, String> jsonNames, Set<String> required) {

        String jsonName(String property) {
            return jsonNames.getOrDefault(property, property);
        }
    }
}
