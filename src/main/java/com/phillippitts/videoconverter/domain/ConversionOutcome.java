package com.phillippitts.videoconverter.domain;

/**
 * Terminal classification of a conversion, stored next to the free-text error message so callers
 * can branch on type instead of matching message text.
 */
public enum ConversionOutcome {
    /** Queued or running; not yet complete. */
    PENDING,
    SUCCEEDED,
    FAILED,
    /** Terminated on user request. */
    ABORTED
}
