package com.fixguard.llm;

/**
 * Completion text plus the token usage the provider reported (0 when it reported none).
 */
public final class LlmCompletion {

    private final String text;
    private final long   inputTokens;
    private final long   outputTokens;
    private final String model;

    public LlmCompletion(String text, long inputTokens, long outputTokens, String model) {
        this.text         = text != null ? text : "";
        this.inputTokens  = Math.max(0, inputTokens);
        this.outputTokens = Math.max(0, outputTokens);
        this.model        = model;
    }

    public String getText()         { return text; }
    public long   getInputTokens()  { return inputTokens; }
    public long   getOutputTokens() { return outputTokens; }
    public String getModel()        { return model; }

    @Override
    public String toString() {
        return String.format("LlmCompletion{model=%s, in=%d, out=%d, textLen=%d}",
                model, inputTokens, outputTokens, text.length());
    }
}
