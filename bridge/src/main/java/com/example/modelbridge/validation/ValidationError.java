package com.example.modelbridge.validation;

import java.util.Objects;

/**
 * One rejected command argument.
 *
 * @param field argument path as the caller sent it, e.g. {@code props[1].name} or {@code updates.isFK}
 */
public record ValidationError(String field, String message) {
    public ValidationError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
    }
}
