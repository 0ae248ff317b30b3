package io.huskytests.core.execution;

import io.huskytests.core.filter.TestFilter;
import io.huskytests.core.model.DiscoveredTestSet;

/**
 * Strategy for running a filtered set of discovered tests and forwarding their
 * results to the host.
 */
public interface ExecutionStrategy {

    StrategyKind kind();

    /**
     * Mode-specific transformation of the incoming filter. Applying it twice with
     * the same inputs yields the same filter as applying it once.
     */
    TestFilter reconcileFilter(TestFilter filter, DiscoveredTestSet discovery);

    /**
     * Runs the tests selected by {@code filter}.
     *
     * @return false only when it was decided, before any work started, that no test should run
     */
    boolean run(TestFilter filter, DiscoveredTestSet discovery);
}
