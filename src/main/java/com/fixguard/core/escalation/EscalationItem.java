package com.fixguard.core.escalation;

import com.fixguard.core.attempt.AttemptRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A task waiting for (or resolved by) a human reviewer.
 *
 * Built by the fix controller, persisted as JSON by {@link EscalationQueue}, and only
 * changed afterwards through {@link EscalationQueue#resolve}.
 */
public class EscalationItem {

    private String              taskId;
    private String              feature;
    private String              codePath;
    private String              logsPath;
    private List<String>        screenshots    = new ArrayList<>();
    private int                 attempts;
    private String              lastError;
    private Double              priority;
    private Severity            severity;
    private EscalationReason    escalationReason;
    private String              aiDiagnosis;
    private Double              aiConfidence;
    private Map<String, String> artifacts      = new LinkedHashMap<>();
    private List<AttemptRecord> attemptHistory = new ArrayList<>();
    private Instant             createdAt;
    private boolean             resolved;
    private Instant             resolvedAt;
    private Annotation          annotation;

    public EscalationItem() {}

    public EscalationItem(String taskId) {
        this.taskId = taskId;
    }

    public String getTaskId()                { return taskId; }
    public void   setTaskId(String taskId)   { this.taskId = taskId; }

    public String getFeature()                 { return feature; }
    public void   setFeature(String feature)   { this.feature = feature; }

    public String getCodePath()                { return codePath; }
    public void   setCodePath(String codePath) { this.codePath = codePath; }

    public String getLogsPath()                { return logsPath; }
    public void   setLogsPath(String logsPath) { this.logsPath = logsPath; }

    public List<String> getScreenshots() { return screenshots; }
    public void setScreenshots(List<String> screenshots) {
        this.screenshots = screenshots != null ? new ArrayList<>(screenshots) : new ArrayList<>();
    }

    public int  getAttempts()             { return attempts; }
    public void setAttempts(int attempts) { this.attempts = attempts; }

    public String getLastError()                 { return lastError; }
    public void   setLastError(String lastError) { this.lastError = lastError; }

    /** Null until the queue or the controller assigns one. */
    public Double getPriority()                { return priority; }
    public void   setPriority(Double priority) { this.priority = priority; }

    public Severity getSeverity()                  { return severity; }
    public void     setSeverity(Severity severity) { this.severity = severity; }

    public EscalationReason getEscalationReason() { return escalationReason; }
    public void setEscalationReason(EscalationReason escalationReason) {
        this.escalationReason = escalationReason;
    }

    public String getAiDiagnosis()                   { return aiDiagnosis; }
    public void   setAiDiagnosis(String aiDiagnosis) { this.aiDiagnosis = aiDiagnosis; }

    public Double getAiConfidence()                    { return aiConfidence; }
    public void   setAiConfidence(Double aiConfidence) { this.aiConfidence = aiConfidence; }

    public Map<String, String> getArtifacts() { return artifacts; }
    public void setArtifacts(Map<String, String> artifacts) {
        this.artifacts = artifacts != null ? new LinkedHashMap<>(artifacts) : new LinkedHashMap<>();
    }

    public List<AttemptRecord> getAttemptHistory() { return attemptHistory; }
    public void setAttemptHistory(List<AttemptRecord> attemptHistory) {
        this.attemptHistory = attemptHistory != null ? new ArrayList<>(attemptHistory) : new ArrayList<>();
    }

    public Instant getCreatedAt()                  { return createdAt; }
    public void    setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public boolean isResolved()                 { return resolved; }
    public void    setResolved(boolean resolved) { this.resolved = resolved; }

    public Instant getResolvedAt()                   { return resolvedAt; }
    public void    setResolvedAt(Instant resolvedAt) { this.resolvedAt = resolvedAt; }

    public Annotation getAnnotation()                      { return annotation; }
    public void       setAnnotation(Annotation annotation) { this.annotation = annotation; }

    @Override
    public String toString() {
        return "EscalationItem{" + taskId + ", reason=" + escalationReason + ", severity=" + severity
                + ", priority=" + priority + ", resolved=" + resolved + "}";
    }
}
