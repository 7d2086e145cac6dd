package com.fixguard.core.proposal;

import com.fixguard.llm.LlmCompletion;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Per-token pricing used to attribute a dollar cost to each proposal.
 */
@Component
public class GenerationCost {

    private final double costPer1kInput;
    private final double costPer1kOutput;

    public GenerationCost(
            @Value("${fixguard.llm.cost-per-1k-input:0.003}")  double costPer1kInput,
            @Value("${fixguard.llm.cost-per-1k-output:0.015}") double costPer1kOutput
    ) {
        this.costPer1kInput  = costPer1kInput;
        this.costPer1kOutput = costPer1kOutput;
    }

    public double of(LlmCompletion completion) {
        return of(completion.getInputTokens(), completion.getOutputTokens());
    }

    public double of(long inputTokens, long outputTokens) {
        return (inputTokens / 1000.0) * costPer1kInput
             + (outputTokens / 1000.0) * costPer1kOutput;
    }
}
