package com.shelf.matching.pipeline;

import com.shelf.matching.core.MatchingException;
import com.shelf.matching.core.model.FailureKind;

/**
 * A detection item cannot be matched as given, e.g. it has no reference image.
 */
public class ItemValidationException extends MatchingException {

    public ItemValidationException(String message) {
        super(FailureKind.VALIDATION, message);
    }
}
