package com.shelf.matching.scheduler;

import com.shelf.matching.core.MatchingException;
import com.shelf.matching.core.model.FailureKind;

/**
 * A concurrency guarantee of the scheduler was broken. Fatal for the whole run.
 */
public class SchedulerInvariantException extends MatchingException {

    public SchedulerInvariantException(String message) {
        super(FailureKind.SCHEDULER, message);
    }
}
