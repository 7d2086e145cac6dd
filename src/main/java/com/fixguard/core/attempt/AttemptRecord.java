package com.fixguard.core.attempt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable history entry written by {@link AttemptTracker#increment} on every fix attempt.
 * Shown to reviewers as part of an escalation's attempt history.
 */
public final class AttemptRecord {

    private final int     attempt;
    private final Instant timestamp;
    private final String  testPath;

    @JsonCreator
    public AttemptRecord(
            @JsonProperty("attempt")   int     attempt,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("test_path") String  testPath
    ) {
        this.attempt   = attempt;
        this.timestamp = timestamp;
        this.testPath  = testPath;
    }

    public int     getAttempt()   { return attempt; }
    public Instant getTimestamp() { return timestamp; }
    public String  getTestPath()  { return testPath; }

    @Override
    public String toString() {
        return "AttemptRecord{#" + attempt + ", " + testPath + " @ " + timestamp + "}";
    }
}
