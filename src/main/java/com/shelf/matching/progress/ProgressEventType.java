package com.shelf.matching.progress;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of progress event.
 */
public enum ProgressEventType {
    /** Run accepted; precedes every item event. */
    START,

    /** Stage transition or completion of one item. */
    PROGRESS,

    /** Run finished normally, or was stopped and drained. */
    COMPLETE,

    /** Run aborted by a fatal failure. */
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
