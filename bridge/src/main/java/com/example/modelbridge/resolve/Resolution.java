package com.example.modelbridge.resolve;

import com.example.modelbridge.api.AmbiguousEntityException;
import com.example.modelbridge.api.EntityNotFoundException;

/**
 * Outcome of a name lookup: either the resolved entity, or a not-found result carrying what was
 * searched for and where.
 */
public record Resolution(String kind, String name, String scope, ResolvedEntity entity) {

    public static Resolution found(String kind, String name, String scope, ResolvedEntity entity) {
        return new Resolution(kind, name, scope, entity);
    }

    public static Resolution notFound(String kind, String name, String scope) {
        return new Resolution(kind, name, scope, null);
    }

    public boolean isFound() {
        return entity != null;
    }

    public ResolvedEntity orElseThrow() {
        if (entity == null) {
            throw new EntityNotFoundException(kind, name, scope);
        }
        return entity;
    }

    /**
     * The resolved entity for a write: fails when missing, and when the name was found under
     * several owners with no owner hint to choose between them.
     */
    public ResolvedEntity requireUnambiguous() {
        ResolvedEntity resolved = orElseThrow();
        if (resolved.isAmbiguous()) {
            throw new AmbiguousEntityException(kind, name, resolved.candidates());
        }
        return resolved;
    }
}
