package io.huskytests.core.model;

import java.time.Duration;

/**
 * A finalized per-test result handed to the host.
 */
public record TestResult(
        TestCase testCase,
        TestOutcome outcome,
        Duration duration,
        String output,
        String errorMessage,
        String errorStackTrace
) {}
