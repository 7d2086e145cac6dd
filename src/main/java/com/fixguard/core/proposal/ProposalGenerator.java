package com.fixguard.core.proposal;

/**
 * Source of candidate fixes. Consumed as an opaque service by the fix controller.
 */
@FunctionalInterface
public interface ProposalGenerator {

    /**
     * @throws ProposalGenerationException when no response could be obtained;
     *         the exception carries any cost already incurred
     */
    GeneratedProposal propose(FixContext context);
}
