package com.fixguard.core.proposal;

/**
 * The proposal text is missing a required marker (code block or diagnosis).
 */
public class ProposalParseException extends Exception {

    public ProposalParseException(String message) {
        super(message);
    }
}
