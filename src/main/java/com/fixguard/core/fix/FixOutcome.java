package com.fixguard.core.fix;

public enum FixOutcome {
    /** The edit is in place and introduced no new failures. */
    FIX_APPLIED,
    /** Handed to the human review queue. */
    ESCALATED,
    /** Failed locally; nothing was queued. */
    ABORTED
}
