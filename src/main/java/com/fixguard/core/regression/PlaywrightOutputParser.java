package com.fixguard.core.regression;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns `npx playwright test` console output into a RegressionSnapshot.
 *
 * Reads the list reporter's summary lines:
 *
 *     2 passed (3.1s)
 *     1 failed
 *
 * and, when something failed, every "Error: ..." line as an error detail.
 *
 * A non-zero exit with neither a passed nor a failed count means the suite never
 * produced a result (npx missing, config error, browser install missing) and is
 * reported as not run rather than as "0 passed, 0 failed".
 */
@Component
public class PlaywrightOutputParser {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightOutputParser.class);

    static final int MAX_RAW_OUTPUT_CHARS = 2000;

    private static final Pattern PASSED_PATTERN = Pattern.compile("(\\d+)\\s+passed");
    private static final Pattern FAILED_PATTERN = Pattern.compile("(\\d+)\\s+failed");

    // [^\n\r]+ so a match never runs into the next reporter line
    private static final Pattern ERROR_PATTERN =
        Pattern.compile("Error:\\s*([^\\n\\r]+)", Pattern.MULTILINE);

    public RegressionSnapshot parse(String output, int exitCode) {

        String text = output != null ? output : "";
        log.info("[Regression] Parsing {} chars of runner output (exit={})", text.length(), exitCode);

        Integer passed = firstCount(PASSED_PATTERN, text);
        Integer failed = firstCount(FAILED_PATTERN, text);

        if (passed == null && failed == null && exitCode != 0) {
            log.warn("[Regression] No test summary found and exit code {}", exitCode);
            return RegressionSnapshot.notRun(
                "Regression runner exited with code " + exitCode + " without a test summary: "
                    + firstLine(text));
        }

        int passedCount = passed != null ? passed : 0;
        int failedCount = failed != null ? failed : 0;

        List<String> errors = new ArrayList<>();
        if (failedCount > 0) {
            Matcher matcher = ERROR_PATTERN.matcher(text);
            while (matcher.find()) {
                errors.add(matcher.group(1).trim());
            }
        }

        return new RegressionSnapshot(passedCount, failedCount, errors, truncate(text), exitCode);
    }

    private Integer firstCount(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) return null;
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String truncate(String text) {
        return text.length() <= MAX_RAW_OUTPUT_CHARS ? text : text.substring(0, MAX_RAW_OUTPUT_CHARS);
    }

    private static String firstLine(String text) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) return "<no output>";
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline);
    }
}
