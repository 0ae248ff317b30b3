package io.huskytests.core.execution;

import io.huskytests.core.filter.TestFilter;
import io.huskytests.core.model.DiscoveredTestSet;

/**
 * Runs tests for a development environment. The environment's live selection,
 * as reflected by the loaded test cases, wins over any precomputed filter.
 */
public final class InteractiveStrategy implements ExecutionStrategy {

    private final ExecutionContext ctx;

    public InteractiveStrategy(ExecutionContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.INTERACTIVE;
    }

    @Override
    public TestFilter reconcileFilter(TestFilter filter, DiscoveredTestSet discovery) {
        if (!discovery.isDiscoveryMethodCurrent()) {
            return filter;
        }
        if (filter.isEmpty()) {
            return filter;
        }
        return DiscoveryFilters.rebuild(ctx, discovery);
    }

    @Override
    public boolean run(TestFilter filter, DiscoveredTestSet discovery) {
        return InProcessRun.run(this, ctx, filter, discovery);
    }
}
