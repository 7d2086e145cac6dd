package com.fixguard.core.artifact;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Unified diffs of a test file before and after a proposed fix, for the audit trail
 * and for reviewers.
 */
@Component
public class DiffGenerator {

    static final int CONTEXT_LINES = 3;

    /**
     * @return the unified diff with a/ and b/ headers, or an empty string when the
     *         contents are identical
     */
    public String unifiedDiff(String original, String fixed, String path) {
        List<String> originalLines = toLines(original);
        List<String> fixedLines    = toLines(fixed);

        Patch<String> patch = DiffUtils.diff(originalLines, fixedLines);
        if (patch.getDeltas().isEmpty()) return "";

        List<String> diffLines = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + path, "b/" + path, originalLines, patch, CONTEXT_LINES);
        return String.join("\n", diffLines) + "\n";
    }

    private static List<String> toLines(String content) {
        if (content == null || content.isEmpty()) return List.of();
        // -1 keeps the trailing empty element, so a dropped final newline shows up as a change
        return Arrays.asList(content.split("\\R", -1));
    }
}
