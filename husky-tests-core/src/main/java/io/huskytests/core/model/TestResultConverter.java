package io.huskytests.core.model;

/**
 * Turns an engine-side outcome into the host-side result.
 */
@FunctionalInterface
public interface TestResultConverter {

    TestResult convert(TestCaseOutcome outcome);
}
