package com.example.modelbridge.command;

import tools.jackson.databind.node.ObjectNode;

/**
 * Executes one command with its bound arguments and returns the payload fields of the success envelope.
 */
@FunctionalInterface
public interface CommandHandler<A> {

    ObjectNode handle(A arguments);
}
