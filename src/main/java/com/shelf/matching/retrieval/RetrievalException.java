package com.shelf.matching.retrieval;

import com.shelf.matching.core.MatchingException;
import com.shelf.matching.core.model.FailureKind;

/**
 * Catalog search failed or timed out for one item.
 */
public class RetrievalException extends MatchingException {

    public RetrievalException(String message) {
        super(FailureKind.RETRIEVAL, message);
    }

    public RetrievalException(String message, Throwable cause) {
        super(FailureKind.RETRIEVAL, message, cause);
    }
}
