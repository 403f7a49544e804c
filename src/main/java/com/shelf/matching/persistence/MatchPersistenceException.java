package com.shelf.matching.persistence;

import com.shelf.matching.core.MatchingException;
import com.shelf.matching.core.model.FailureKind;

/**
 * The persistence collaborator failed to store an item result.
 */
public class MatchPersistenceException extends MatchingException {

    public MatchPersistenceException(String message, Throwable cause) {
        super(FailureKind.INTERNAL, message, cause);
    }
}
