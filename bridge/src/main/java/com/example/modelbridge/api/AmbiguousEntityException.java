package com.example.modelbridge.api;

import lombok.Getter;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Thrown when a mutation names an entity held by several owners without an owner hint.
 */
@Getter
public class AmbiguousEntityException extends BridgeException {

    private final String kind;
    private final String name;
    private final List<String> candidates;

    public AmbiguousEntityException(String kind, String name, List<String> candidates) {
        super("Ambiguous " + kind + " '" + name + "': found under " + candidates
                + "; pass owner_object_name to choose one");
        this.kind = kind;
        this.name = name;
        this.candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    @Override
    public ErrorCode errorCode() {
        return ErrorCode.AMBIGUOUS;
    }

    @Override
    public void describe(ObjectNode body) {
        body.put("ambiguous", true);
        ArrayNode list = body.putArray("candidates");
        candidates.forEach(list::add);
    }
}
