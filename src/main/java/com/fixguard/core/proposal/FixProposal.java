package com.fixguard.core.proposal;

/**
 * A parsed repair proposal: the model's one-line root cause, its self-rated
 * confidence in [0, 1], and the complete replacement content of the test file.
 */
public final class FixProposal {

    private final String diagnosis;
    private final double confidence;
    private final String fixedContent;
    private final boolean confidenceReported;

    public FixProposal(String diagnosis, double confidence, String fixedContent, boolean confidenceReported) {
        this.diagnosis          = diagnosis;
        this.confidence         = Math.max(0.0, Math.min(1.0, confidence));
        this.fixedContent       = fixedContent;
        this.confidenceReported = confidenceReported;
    }

    public String  getDiagnosis()         { return diagnosis; }
    public double  getConfidence()        { return confidence; }
    public String  getFixedContent()      { return fixedContent; }

    /** False when the response had no CONFIDENCE marker and the default was used. */
    public boolean isConfidenceReported() { return confidenceReported; }

    @Override
    public String toString() {
        return String.format("FixProposal{confidence=%.2f%s, diagnosis='%s', contentLen=%d}",
                confidence, confidenceReported ? "" : " (default)", diagnosis, fixedContent.length());
    }
}
