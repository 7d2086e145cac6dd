package com.fixguard.core.proposal;

import java.util.List;

/**
 * Everything the proposal generator is given for one pass: the failing test,
 * its current content, the error, and best-effort hints gathered from the workspace.
 */
public final class FixContext {

    private final String       testPath;
    private final String       testContent;
    private final String       errorMessage;
    private final List<String> selectorUsage;
    private final List<String> relatedTests;

    public FixContext(
            String       testPath,
            String       testContent,
            String       errorMessage,
            List<String> selectorUsage,
            List<String> relatedTests
    ) {
        this.testPath      = testPath;
        this.testContent   = testContent;
        this.errorMessage  = errorMessage != null ? errorMessage : "";
        this.selectorUsage = selectorUsage != null ? List.copyOf(selectorUsage) : List.of();
        this.relatedTests  = relatedTests != null ? List.copyOf(relatedTests) : List.of();
    }

    public String       getTestPath()      { return testPath; }
    public String       getTestContent()   { return testContent; }
    public String       getErrorMessage()  { return errorMessage; }
    public List<String> getSelectorUsage() { return selectorUsage; }
    public List<String> getRelatedTests()  { return relatedTests; }
}
