package com.fixguard.core.artifact;

/**
 * Locations of the two audit files written for one verified (or rejected) fix.
 */
public final class ArtifactPaths {

    private final String diffPath;
    private final String reportPath;

    public ArtifactPaths(String diffPath, String reportPath) {
        this.diffPath   = diffPath;
        this.reportPath = reportPath;
    }

    public String getDiffPath()   { return diffPath; }
    public String getReportPath() { return reportPath; }

    @Override
    public String toString() {
        return "ArtifactPaths{diff=" + diffPath + ", report=" + reportPath + "}";
    }
}
