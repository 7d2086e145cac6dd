package com.fixguard.core.fix;

/**
 * Why a pass aborted without escalating.
 */
public enum FailureKind {
    STORE_UNAVAILABLE,
    BASELINE_CAPTURE_FAILURE,
    FILE_ACCESS_FAILURE,
    PROPOSAL_GENERATION_FAILURE,
    PROPOSAL_PARSE_FAILURE,
    /** The suite could not be run after the edit; the original file was restored. */
    POST_FIX_RUN_FAILURE,
    /** Only in unattended mode; supervised mode escalates instead. */
    MAX_RETRIES_EXCEEDED
}
