package com.example.modelbridge.api;

import lombok.Getter;
import tools.jackson.databind.node.ObjectNode;

/**
 * Thrown when a named entity cannot be resolved. Mapped to 404 {@code not_found}.
 */
@Getter
public class EntityNotFoundException extends BridgeException {

    private final String kind;
    private final String name;
    private final String scope;

    public EntityNotFoundException(String kind, String name, String scope) {
        super(scope == null || scope.isEmpty()
                ? capitalize(kind) + " '" + name + "' not found"
                : capitalize(kind) + " '" + name + "' not found in " + scope);
        this.kind = kind;
        this.name = name;
        this.scope = scope;
    }

    @Override
    public ErrorCode errorCode() {
        return ErrorCode.NOT_FOUND;
    }

    @Override
    public void describe(ObjectNode body) {
        body.put("kind", kind);
        body.put("name", name);
        if (scope != null) {
            body.put("scope", scope);
        }
    }

    private static String capitalize(String value) {
        return value == null || value.isEmpty() ? "Entity" : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
