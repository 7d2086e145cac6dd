package com.fixguard.core.fix;

/**
 * Phases of one fix pass, in order. A pass stops at the first terminal outcome.
 *
 * ATTEMPT_CHECK        : count the attempt; over the limit means escalate (or abort when unattended).
 * BASELINE_CAPTURE     : run the regression suite before touching anything.
 * PROPOSAL_GENERATION  : read the test, gather hints, ask for and parse a proposal.
 * CONFIDENCE_GATE      : below the threshold the file stays untouched and the task is escalated.
 * APPLY                : compute the audit diff and overwrite the test file.
 * POST_FIX_REGRESSION  : run the same suite against the edited file.
 * COMPARE              : any new failure restores the original bytes and escalates.
 */
public enum FixPhase {
    ATTEMPT_CHECK,
    BASELINE_CAPTURE,
    PROPOSAL_GENERATION,
    CONFIDENCE_GATE,
    APPLY,
    POST_FIX_REGRESSION,
    COMPARE
}
