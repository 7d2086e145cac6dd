package com.fixguard.core.fix;

import com.fixguard.core.artifact.ArtifactWriter;

import java.time.Clock;

/**
 * One failing test handed to the fix engine. The attempt count is filled in once
 * the attempt tracker has counted the current pass.
 */
public final class FixTask {

    private final String taskId;
    private final String testPath;
    private final String errorMessage;
    private final String feature;
    private final int    attemptCount;

    private FixTask(String taskId, String testPath, String errorMessage, String feature, int attemptCount) {
        this.taskId       = taskId;
        this.testPath     = testPath;
        this.errorMessage = errorMessage;
        this.feature      = feature;
        this.attemptCount = attemptCount;
    }

    /**
     * Task id defaults to fix_&lt;epochSeconds&gt;_&lt;stem&gt;, feature to the test file stem.
     */
    public static FixTask create(String testPath, String errorMessage, String taskId, String feature, Clock clock) {
        if (testPath == null || testPath.isBlank()) {
            throw new IllegalArgumentException("test_path is required");
        }
        String stem = ArtifactWriter.stemOf(testPath);
        String id   = (taskId == null || taskId.isBlank())
                ? "fix_" + clock.instant().getEpochSecond() + "_" + stem
                : taskId;
        String feat = (feature == null || feature.isBlank()) ? stem : feature;
        return new FixTask(id, testPath, errorMessage != null ? errorMessage : "", feat, 0);
    }

    public FixTask withAttemptCount(int attempts) {
        return new FixTask(taskId, testPath, errorMessage, feature, attempts);
    }

    public String getTaskId()       { return taskId; }
    public String getTestPath()     { return testPath; }
    public String getErrorMessage() { return errorMessage; }
    public String getFeature()      { return feature; }
    public int    getAttemptCount() { return attemptCount; }

    @Override
    public String toString() {
        return "FixTask{" + taskId + ", " + testPath + ", attempt=" + attemptCount + "}";
    }
}
