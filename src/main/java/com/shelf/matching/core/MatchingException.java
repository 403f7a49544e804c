package com.shelf.matching.core;

import com.shelf.matching.core.model.FailureKind;

import java.util.Objects;

/**
 * Base type for failures raised while matching a single detection item.
 * Each subclass declares the {@link FailureKind} it is reported under, so the
 * scheduler can convert it into an error decision without inspecting types.
 */
public abstract class MatchingException extends RuntimeException {

    private final FailureKind kind;

    protected MatchingException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    protected MatchingException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public FailureKind getKind() {
        return kind;
    }
}
