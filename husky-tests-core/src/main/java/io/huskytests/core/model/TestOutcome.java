package io.huskytests.core.model;

/**
 * Outcome as understood by the host result-recording API.
 */
public enum TestOutcome {
    NONE,
    PASSED,
    FAILED,
    SKIPPED
}
