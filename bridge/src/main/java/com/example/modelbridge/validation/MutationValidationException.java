package com.example.modelbridge.validation;

import com.example.modelbridge.api.BridgeException;
import com.example.modelbridge.api.ErrorCode;
import lombok.Getter;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Thrown when a mutation breaks naming, uniqueness, referential or enumeration rules.
 * <p>
 * Mapped to HTTP 400 {@code validation_failed} with {@link #getErrors()} in the envelope.
 * </p>
 */
@Getter
public class MutationValidationException extends BridgeException {

    private final List<ValidationError> errors;

    public MutationValidationException(List<ValidationError> errors) {
        super("Validation failed: " + (errors != null ? errors.size() + " error(s)" : ""));
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public MutationValidationException(String field, String message) {
        this(List.of(new ValidationError(field, message)));
    }

    @Override
    public ErrorCode errorCode() {
        return ErrorCode.VALIDATION_FAILED;
    }

    @Override
    public void describe(ObjectNode body) {
        ArrayNode list = body.putArray("errors");
        for (ValidationError error : errors) {
            list.addObject().put("field", error.field()).put("message", error.message());
        }
    }
}
