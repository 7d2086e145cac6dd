package com.fixguard.core.proposal;

import com.fixguard.core.filesystem.FileSystemManager;
import com.fixguard.core.filesystem.FileSystemManager.FileSystemException;
import com.fixguard.core.filesystem.FileSystemManager.SearchResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort hints for the repair prompt.
 *
 * Pulls the first data-testid selector out of the error message and looks for other
 * usages of it under tests/. Any failure here degrades to an empty context; it never
 * aborts a fix attempt.
 */
@Component
public class ContextGatherer {

    private static final Logger log = LoggerFactory.getLogger(ContextGatherer.class);

    static final int    MAX_USAGE_LINES = 5;
    static final String TESTS_DIR       = "tests";

    private static final Pattern SELECTOR_IN_ERROR = Pattern.compile("data-testid[=\"']+([^\"'\\]\\s)]+)");
    private static final Pattern SAFE_SELECTOR     = Pattern.compile("^[a-zA-Z0-9_:-]+$");

    private final FileSystemManager fileSystem;

    public ContextGatherer(FileSystemManager fileSystem) {
        this.fileSystem = fileSystem;
    }

    public FixContext gather(String testPath, String testContent, String errorMessage) {

        String selector = extractSelector(errorMessage);
        if (selector == null) {
            return new FixContext(testPath, testContent, errorMessage, List.of(), List.of());
        }

        List<String> usage   = new ArrayList<>();
        Set<String>  related = new LinkedHashSet<>();

        try {
            if (fileSystem.isDirectory(TESTS_DIR)) {
                String pattern = Pattern.quote("data-testid=\"" + selector + "\"");
                for (SearchResult hit : fileSystem.grep(pattern, TESTS_DIR, MAX_USAGE_LINES)) {
                    usage.add(hit.toString());
                    if (!samePath(hit.getFilePath(), testPath)) related.add(hit.getFilePath());
                }
            }
        } catch (FileSystemException | RuntimeException e) {
            log.warn("[Context] Selector search failed for '{}': {}", selector, e.getMessage());
            return new FixContext(testPath, testContent, errorMessage, List.of(), List.of());
        }

        log.info("[Context] Selector '{}': {} usage line(s), {} related test(s)",
                selector, usage.size(), related.size());
        return new FixContext(testPath, testContent, errorMessage, usage, new ArrayList<>(related));
    }

    /**
     * First data-testid value named in the error, or null when there is none or
     * it contains anything outside [a-zA-Z0-9_:-].
     */
    String extractSelector(String errorMessage) {
        if (errorMessage == null) return null;
        Matcher matcher = SELECTOR_IN_ERROR.matcher(errorMessage);
        if (!matcher.find()) return null;

        String selector = matcher.group(1);
        if (!SAFE_SELECTOR.matcher(selector).matches()) {
            log.warn("[Context] Skipping unsafe selector '{}'", selector);
            return null;
        }
        return selector;
    }

    private static boolean samePath(String a, String b) {
        return normalise(a).equals(normalise(b));
    }

    private static String normalise(String path) {
        String p = path.replace('\\', '/');
        return p.startsWith("./") ? p.substring(2) : p;
    }
}
