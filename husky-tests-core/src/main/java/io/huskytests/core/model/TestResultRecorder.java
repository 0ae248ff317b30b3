package io.huskytests.core.model;

/**
 * The host's result-recording API. Accepts one finalized result at a time.
 */
@FunctionalInterface
public interface TestResultRecorder {

    void recordResult(TestResult result);
}
