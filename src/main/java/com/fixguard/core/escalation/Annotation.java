package com.fixguard.core.escalation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A human resolver's verdict on an escalated task. Attached to the item on resolve
 * and copied into the learning store.
 */
public final class Annotation {

    private final String   rootCauseCategory;
    private final String   fixStrategy;
    private final Severity severity;
    private final String   humanNotes;
    private final String   patchDiff;

    @JsonCreator
    public Annotation(
            @JsonProperty("root_cause_category") String   rootCauseCategory,
            @JsonProperty("fix_strategy")        String   fixStrategy,
            @JsonProperty("severity")            Severity severity,
            @JsonProperty("human_notes")         String   humanNotes,
            @JsonProperty("patch_diff")          String   patchDiff
    ) {
        this.rootCauseCategory = rootCauseCategory;
        this.fixStrategy       = fixStrategy;
        this.severity          = severity;
        this.humanNotes        = humanNotes;
        this.patchDiff         = patchDiff;
    }

    public String   getRootCauseCategory() { return rootCauseCategory; }
    public String   getFixStrategy()       { return fixStrategy; }
    public Severity getSeverity()          { return severity; }
    public String   getHumanNotes()        { return humanNotes; }
    public String   getPatchDiff()         { return patchDiff; }

    @Override
    public String toString() {
        return "Annotation{" + rootCauseCategory + ", strategy=" + fixStrategy + ", severity=" + severity + "}";
    }
}
