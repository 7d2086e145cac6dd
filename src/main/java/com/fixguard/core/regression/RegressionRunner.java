package com.fixguard.core.regression;

import java.util.List;

/**
 * Runs a list of test files and reports pass/fail counts.
 *
 * Implementations never throw for run failures; a timeout or a runner that could not
 * start is reported through {@link RegressionSnapshot#timedOut} / {@link RegressionSnapshot#notRun}.
 */
@FunctionalInterface
public interface RegressionRunner {

    RegressionSnapshot run(List<String> suite);
}
