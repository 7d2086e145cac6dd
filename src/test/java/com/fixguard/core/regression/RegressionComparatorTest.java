package com.fixguard.core.regression;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegressionComparatorTest {

    @Test
    void testUnchangedSuiteHasNoNewFailures() {
        Comparison comparison = RegressionComparator.compare(
                RegressionSnapshot.of(2, 0), RegressionSnapshot.of(2, 0));

        assertEquals(0, comparison.getNewFailures());
        assertFalse(comparison.isImproved());
        assertTrue(comparison.isInvariantHonored());
    }

    @Test
    void testOneNewFailureIsDetected() {
        Comparison comparison = RegressionComparator.compare(
                RegressionSnapshot.of(2, 0), RegressionSnapshot.of(1, 1));

        assertEquals(1, comparison.getNewFailures());
        assertFalse(comparison.isInvariantHonored());
        assertEquals(2, comparison.getBaselinePassed());
        assertEquals(1, comparison.getAfterFailed());
    }

    @Test
    void testFewerFailuresCountAsImprovement() {
        Comparison comparison = RegressionComparator.compare(
                RegressionSnapshot.of(1, 2), RegressionSnapshot.of(3, 0));

        assertEquals(0, comparison.getNewFailures());
        assertTrue(comparison.isImproved());
    }

    @Test
    void testNewFailuresNeverNegative() {
        for (int baselineFailed = 0; baselineFailed <= 3; baselineFailed++) {
            for (int afterFailed = 0; afterFailed <= 3; afterFailed++) {
                Comparison c = RegressionComparator.compare(
                        RegressionSnapshot.of(5, baselineFailed), RegressionSnapshot.of(5, afterFailed));
                assertTrue(c.getNewFailures() >= 0);
                assertEquals(afterFailed < baselineFailed, c.isImproved());
            }
        }
    }

    @Test
    void testSameCountDifferentTestsIsNotARegression() {
        // Counts only: a different failing test with the same total is not flagged
        RegressionSnapshot baseline = new RegressionSnapshot(1, 1, List.of("login failed"), "", 1);
        RegressionSnapshot after    = new RegressionSnapshot(1, 1, List.of("nav failed"), "", 1);

        assertEquals(0, RegressionComparator.compare(baseline, after).getNewFailures());
    }
}
