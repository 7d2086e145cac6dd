package com.fixguard.llm;

/**
 * Single interface for all model calls made by the fix engine.
 *
 * Implementations return the raw completion text together with token usage so the
 * caller can attribute cost. They throw {@link LlmException} when no completion
 * could be obtained; an empty model answer is returned as empty text, not an error.
 */
public interface LLMClient {

    /** Repair proposals want near-deterministic output. */
    double REPAIR_TEMPERATURE = 0.1;

    LlmCompletion generate(String prompt, double temperature);

    default LlmCompletion generate(String prompt) {
        return generate(prompt, REPAIR_TEMPERATURE);
    }

    /** Model identifier, for logs and cost attribution. */
    String getModelName();
}
