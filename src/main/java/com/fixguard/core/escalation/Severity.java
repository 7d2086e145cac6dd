package com.fixguard.core.escalation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of an escalation, with the base priority each level contributes.
 */
public enum Severity {

    LOW(0.1),
    MEDIUM(0.3),
    HIGH(0.5),
    CRITICAL(0.7);

    private final double baseScore;

    Severity(double baseScore) {
        this.baseScore = baseScore;
    }

    public double getBaseScore() {
        return baseScore;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromCode(String code) {
        if (code == null) return null;
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: " + code, e);
        }
    }
}
