package io.huskytests.core.config;

/**
 * How test cases were discovered before execution.
 * {@link #LEGACY} filters arrive already resolved by the discovery step.
 */
public enum DiscoveryMethod {
    CURRENT,
    LEGACY
}
