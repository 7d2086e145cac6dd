package com.fixguard.core.proposal;

import com.fixguard.llm.LLMClient;
import com.fixguard.llm.LlmCompletion;
import com.fixguard.llm.LlmException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * ProposalGenerator backed by whichever LLMClient the active profile provides.
 */
@Component
public class LlmProposalGenerator implements ProposalGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmProposalGenerator.class);

    private final LLMClient        llmClient;
    private final FixPromptBuilder promptBuilder;
    private final GenerationCost   cost;

    public LlmProposalGenerator(LLMClient llmClient, FixPromptBuilder promptBuilder, GenerationCost cost) {
        this.llmClient     = llmClient;
        this.promptBuilder = promptBuilder;
        this.cost          = cost;
    }

    @Override
    public GeneratedProposal propose(FixContext context) {

        String prompt = promptBuilder.build(context);
        log.info("[Proposal] Requesting fix for {} from {} (promptLen={})",
                context.getTestPath(), llmClient.getModelName(), prompt.length());

        LlmCompletion completion;
        try {
            completion = llmClient.generate(prompt, LLMClient.REPAIR_TEMPERATURE);
        } catch (LlmException e) {
            double spent = cost.of(e.getInputTokens(), e.getOutputTokens());
            log.error("[Proposal] Generation failed for {}: {} (spent ${})",
                    context.getTestPath(), e.getMessage(), String.format("%.4f", spent));
            throw new ProposalGenerationException("AI fix generation failed: " + e.getMessage(), e, spent);
        } catch (RuntimeException e) {
            log.error("[Proposal] Generation failed for {}: {}", context.getTestPath(), e.getMessage());
            throw new ProposalGenerationException("AI fix generation failed: " + e.getMessage(), e, 0.0);
        }

        double costUsd = cost.of(completion);
        log.info("[Proposal] {} -> ${}", completion, String.format("%.4f", costUsd));

        return new GeneratedProposal(completion.getText(), costUsd, completion.getModel());
    }
}
