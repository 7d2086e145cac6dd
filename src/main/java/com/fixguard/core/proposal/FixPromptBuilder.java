package com.fixguard.core.proposal;

import com.fixguard.core.filesystem.FileSystemManager;
import com.fixguard.core.filesystem.FileSystemManager.FileSystemException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds the repair prompt sent to the LLM.
 *
 * The answer format requested here is the one {@link ProposalParser} reads back.
 * An optional application context file (selector reference, page map) is inlined
 * when present in the workspace.
 */
@Component
public class FixPromptBuilder {

    private static final Logger log = LoggerFactory.getLogger(FixPromptBuilder.class);

    private static final String RULES = """
            You repair failing Playwright tests with MINIMAL surgical edits.

            RULES:
            - Do not break tests that currently pass
            - Change as few lines as possible (1-3 if you can)
            - Prefer selector updates over logic changes
            - Keep the existing test structure and style

            """;

    private static final String ANSWER_FORMAT = """
            COMMON FIX PATTERNS:
            1. Selector not found: update the data-testid or add a waitForSelector
            2. Timeout: raise the timeout or wait for an intermediate state
            3. Assertion failure: check expected against actual values

            INSTRUCTIONS:
            1. Diagnose the root cause
            2. Apply the SMALLEST possible fix
            3. Rate your confidence in the fix (0.0-1.0)
            4. Return the COMPLETE fixed file, not only the changed section
            5. Answer in exactly this format:

            DIAGNOSIS: <one-line root cause>

            CONFIDENCE: <0.0-1.0>
            (0.0-0.5 uncertain, 0.5-0.7 moderate, 0.7-0.9 confident, 0.9-1.0 very confident)

            FIX:
            ```typescript
            <complete fixed test file>
            ```

            Do not add or remove tests. If the root cause is unclear, rate your confidence low.
            """;

    private final FileSystemManager fileSystem;
    private final String            appContextFile;

    public FixPromptBuilder(
            FileSystemManager fileSystem,
            @Value("${fixguard.proposal.app-context-file:app_context.md}") String appContextFile
    ) {
        this.fileSystem     = fileSystem;
        this.appContextFile = appContextFile;
    }

    public String build(FixContext context) {

        StringBuilder prompt = new StringBuilder(RULES);

        prompt.append("TEST FILE: ").append(context.getTestPath()).append("\n");
        prompt.append("ERROR MESSAGE:\n").append(context.getErrorMessage()).append("\n\n");

        prompt.append("CURRENT TEST CODE:\n```typescript\n");
        prompt.append(context.getTestContent());
        if (!context.getTestContent().endsWith("\n")) prompt.append("\n");
        prompt.append("```\n\n");

        String appContext = loadAppContext();
        if (appContext != null) {
            prompt.append("=== APPLICATION CONTEXT (use these selectors) ===\n");
            prompt.append(appContext.strip()).append("\n");
            prompt.append("=== END APPLICATION CONTEXT ===\n\n");
        }

        if (!context.getSelectorUsage().isEmpty()) {
            prompt.append("=== SELECTOR USAGE ELSEWHERE ===\n");
            context.getSelectorUsage().forEach(line -> prompt.append(line).append("\n"));
            prompt.append("=== END SELECTOR USAGE ===\n\n");
        }

        if (!context.getRelatedTests().isEmpty()) {
            prompt.append("Related tests: ")
                  .append(String.join(", ", context.getRelatedTests()))
                  .append("\n\n");
        }

        prompt.append(ANSWER_FORMAT);
        return prompt.toString();
    }

    private String loadAppContext() {
        if (appContextFile == null || appContextFile.isBlank()) return null;
        if (!fileSystem.fileExists(appContextFile)) return null;
        try {
            return fileSystem.readFile(appContextFile);
        } catch (FileSystemException e) {
            log.warn("[Prompt] Could not load {}: {}", appContextFile, e.getMessage());
            return null;
        }
    }
}
