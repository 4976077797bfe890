package com.koni.mobility.domain.exception;

import com.koni.mobility.domain.model.EntityKind;

/**
 * Exception thrown by the catalogue repositories when an insert violates a uniqueness
 * constraint. The whole insert has been rolled back when this is thrown.
 */
public class DuplicateEntityException extends RuntimeException {

    private final EntityKind kind;

    public DuplicateEntityException(EntityKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DuplicateEntityException(EntityKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public EntityKind getKind() {
        return kind;
    }
}
