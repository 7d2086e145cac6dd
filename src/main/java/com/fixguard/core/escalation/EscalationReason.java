package com.fixguard.core.escalation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why a task ended up in front of a human.
 */
public enum EscalationReason {

    MAX_RETRIES_EXCEEDED(Severity.MEDIUM),
    LOW_CONFIDENCE(Severity.MEDIUM),
    REGRESSION_DETECTED(Severity.HIGH),
    /** The post-regression rollback itself failed; the file may still hold the rejected edit. */
    ROLLBACK_FAILED(Severity.CRITICAL);

    private final Severity defaultSeverity;

    EscalationReason(Severity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public Severity getDefaultSeverity() {
        return defaultSeverity;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EscalationReason fromCode(String code) {
        if (code == null) return null;
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
