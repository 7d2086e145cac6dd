package com.fixguard.core.proposal;

/**
 * Raw, unparsed response of the proposal generator and what it cost.
 */
public final class GeneratedProposal {

    private final String rawText;
    private final double costUsd;
    private final String model;

    public GeneratedProposal(String rawText, double costUsd, String model) {
        this.rawText = rawText != null ? rawText : "";
        this.costUsd = costUsd;
        this.model   = model;
    }

    public String getRawText() { return rawText; }
    public double getCostUsd() { return costUsd; }
    public String getModel()   { return model; }
}
