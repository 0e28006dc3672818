package com.example.modelbridge.command;

import java.util.Map;
import java.util.Objects;

/**
 * A named command: its argument record type, whether it mutates the model, and its handler.
 *
 * @param argumentLabels renames argument fields in error reports and the catalogue, for commands that
 *                       share an argument record under different argument names
 */
public record CommandDefinition<A>(
        String name,
        String description,
        boolean mutating,
        Class<A> argumentsType,
        Map<String, String> argumentLabels,
        CommandHandler<A> handler
) {
    public CommandDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(argumentsType, "argumentsType");
        Objects.requireNonNull(handler, "handler");
        description = description != null ? description : "";
        argumentLabels = argumentLabels != null ? Map.copyOf(argumentLabels) : Map.of();
    }

    public static <A> CommandDefinition<A> mutation(String name, String description, Class<A> argumentsType,
                                                    CommandHandler<A> handler) {
        return new CommandDefinition<>(name, description, true, argumentsType, Map.of(), handler);
    }

    public CommandDefinition<A> withArgumentLabels(Map<String, String> labels) {
        return new CommandDefinition<>(name, description, mutating, argumentsType, labels, handler);
    }

    public String label(String argument) {
        return argumentLabels.getOrDefault(argument, argument);
    }
}
