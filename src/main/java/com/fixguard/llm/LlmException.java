package com.fixguard.llm;

/**
 * Failed model call. Token counts are set when the provider billed the request
 * but the answer could not be used; they stay 0 for transport failures.
 */
public class LlmException extends RuntimeException {

    private final long inputTokens;
    private final long outputTokens;

    public LlmException(String message)                  { this(message, null, 0, 0); }
    public LlmException(String message, Throwable cause) { this(message, cause, 0, 0); }

    public LlmException(String message, Throwable cause, long inputTokens, long outputTokens) {
        super(message, cause);
        this.inputTokens  = inputTokens;
        this.outputTokens = outputTokens;
    }

    public long getInputTokens()  { return inputTokens; }
    public long getOutputTokens() { return outputTokens; }
}
