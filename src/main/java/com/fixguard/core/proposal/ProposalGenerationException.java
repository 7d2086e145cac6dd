package com.fixguard.core.proposal;

public class ProposalGenerationException extends RuntimeException {

    private final double costUsd;

    public ProposalGenerationException(String message, Throwable cause, double costUsd) {
        super(message, cause);
        this.costUsd = costUsd;
    }

    public double getCostUsd() {
        return costUsd;
    }
}
