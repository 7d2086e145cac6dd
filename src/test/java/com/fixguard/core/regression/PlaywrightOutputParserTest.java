package com.fixguard.core.regression;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlaywrightOutputParserTest {

    private final PlaywrightOutputParser parser = new PlaywrightOutputParser();

    @Test
    void testAllPassed() {
        String output = """
            Running 2 tests using 1 worker

              ✓  1 tests/auth.spec.ts:3:5 › login works (1.2s)
              ✓  2 tests/core_nav.spec.ts:8:5 › navigation works (0.9s)

              2 passed (3.1s)
            """;

        RegressionSnapshot snapshot = parser.parse(output, 0);

        assertTrue(snapshot.isUsable());
        assertEquals(2, snapshot.getPassed());
        assertEquals(0, snapshot.getFailed());
        assertEquals(2, snapshot.getTotal());
        assertTrue(snapshot.getErrors().isEmpty());
    }

    @Test
    void testFailuresCollectErrorLines() {
        String output = """
            Running 2 tests using 1 worker

              ✘  1 tests/auth.spec.ts:3:5 › login works (30.0s)

                Error: Timed out 5000ms waiting for expect(locator).toBeVisible()
                Locator: getByTestId('login-button')

              1 failed
                tests/auth.spec.ts:3:5 › login works
              1 passed (32.4s)
            """;

        RegressionSnapshot snapshot = parser.parse(output, 1);

        assertTrue(snapshot.isUsable());
        assertEquals(1, snapshot.getPassed());
        assertEquals(1, snapshot.getFailed());
        assertEquals(1, snapshot.getErrors().size());
        assertTrue(snapshot.getErrors().get(0).startsWith("Timed out 5000ms"));
    }

    @Test
    void testNonZeroExitWithoutSummaryIsNotRun() {
        RegressionSnapshot snapshot = parser.parse("sh: npx: command not found\n", 127);

        assertFalse(snapshot.isUsable());
        assertFalse(snapshot.isRan());
        assertTrue(snapshot.getFailureReason().contains("127"));
        assertTrue(snapshot.getFailureReason().contains("npx: command not found"));
    }

    @Test
    void testZeroExitWithoutSummaryIsEmptyRun() {
        RegressionSnapshot snapshot = parser.parse("", 0);

        assertTrue(snapshot.isUsable());
        assertEquals(0, snapshot.getTotal());
    }

    @Test
    void testRawOutputIsTruncated() {
        String output = "x".repeat(5000) + "\n1 passed\n";

        RegressionSnapshot snapshot = parser.parse(output, 0);

        assertEquals(PlaywrightOutputParser.MAX_RAW_OUTPUT_CHARS, snapshot.getRawOutput().length());
        assertEquals(1, snapshot.getPassed());
    }

    @Test
    void testTimedOutSnapshotIsNotUsable() {
        RegressionSnapshot snapshot = RegressionSnapshot.timedOut("partial", 120);

        assertTrue(snapshot.isTimedOut());
        assertFalse(snapshot.isUsable());
        assertEquals(-1, snapshot.getExitCode());
        assertTrue(snapshot.getFailureReason().contains("120s"));
    }
}
