package com.shelf.matching.classification;

import com.shelf.matching.core.MatchingException;
import com.shelf.matching.core.model.FailureKind;

/**
 * Visual classification failed or returned an unusable answer.
 */
public class ClassificationException extends MatchingException {

    public ClassificationException(String message) {
        super(FailureKind.CLASSIFICATION, message);
    }

    public ClassificationException(String message, Throwable cause) {
        super(FailureKind.CLASSIFICATION, message, cause);
    }
}
