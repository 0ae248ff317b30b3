package io.huskytests.core.execution;

/**
 * The three mutually exclusive ways a run can be carried out.
 */
public enum StrategyKind {
    /** Inside the isolated test container; results come back through a mounted file. */
    CONTAINERIZED,
    /** Invoked from a development environment. */
    INTERACTIVE,
    /** Invoked by a non-interactive test runner, e.g. on CI. */
    GENERIC_RUNNER
}
