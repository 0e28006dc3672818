package com.example.modelbridge.command;

import java.util.List;

/**
 * A set of related commands registered with the {@link CommandDispatcher}.
 */
public interface CommandGroup {

    List<CommandDefinition<?>> commands();
}
