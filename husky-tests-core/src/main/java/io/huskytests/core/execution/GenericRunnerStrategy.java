package io.huskytests.core.execution;

import io.huskytests.core.config.DiscoveryMethod;
import io.huskytests.core.config.RunnerSettings;
import io.huskytests.core.filter.ExternalTestFilter;
import io.huskytests.core.filter.TestFilter;
import io.huskytests.core.filter.TestFilterBuilder;
import io.huskytests.core.model.DiscoveredTestSet;

/**
 * Runs tests for a non-interactive runner, which may pass its own filter
 * expression. That expression is resolved into a native filter first; a run
 * that ends up selecting nothing is skipped without touching the engine.
 */
public final class GenericRunnerStrategy implements ExecutionStrategy {

    private final ExecutionContext ctx;

    public GenericRunnerStrategy(ExecutionContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.GENERIC_RUNNER;
    }

    @Override
    public boolean run(TestFilter filter, DiscoveredTestSet discovery) {
        TestFilter resolved = reconcileFilter(checkExternalFilter(filter, discovery), discovery);
        if (resolved.isNoTestsFound()) {
            ctx.runLog().info("   Skipping assembly - no matching test cases found");
            return false;
        }
        return InProcessRun.run(this, ctx, resolved, discovery);
    }

    @Override
    public TestFilter reconcileFilter(TestFilter filter, DiscoveredTestSet discovery) {
        if (!discovery.isDiscoveryMethodCurrent()) {
            return filter;
        }
        RunnerSettings settings = ctx.settings();
        if (!ctx.hasExternalFilter() && !filter.isEmpty()) {
            return DiscoveryFilters.rebuild(ctx, discovery);
        }
        if (ctx.hasExternalFilter() && !settings.useNativeFilter()) {
            int clauses = ctx.externalFilter().clauseCount();
            if (clauses > settings.assemblySelectLimit()) {
                ctx.runLog().debug("Setting filter to no tests found due to external filter size ({} clauses, limit {})",
                        clauses, settings.assemblySelectLimit());
                return TestFilter.NO_TESTS_FOUND;
            }
        }
        return filter;
    }

    /**
     * Replaces {@code filter} with the native form of the runner-supplied filter, if there is one.
     */
    public TestFilter checkExternalFilter(TestFilter filter, DiscoveredTestSet discovery) {
        if (!ctx.hasExternalFilter()) {
            return filter;
        }
        ExternalTestFilter external = ctx.externalFilter();
        ctx.runLog().debug("External filter used, length: {}", external.expression().length());

        RunnerSettings settings = ctx.settings();
        TestFilterBuilder filterBuilder = new TestFilterBuilder(settings);
        TestFilter converted;
        if (settings.discoveryMethod() == DiscoveryMethod.CURRENT) {
            converted = settings.useNativeFilter()
                    ? filterBuilder.convertExternalFilterToFilter(external)
                    : filterBuilder.convertExternalFilterToFilter(external, discovery.allTestCases());
        } else {
            converted = filterBuilder.convertExternalFilterToFilter(external, discovery.loadedTestCases());
        }

        if (ctx.dump() != null) {
            ctx.dump().addString("\n\nExternalFilter: " + external.expression() + "\n");
            ctx.dump().dumpExternalFilter(converted, "(At Execution (ExternalFilter))");
        }
        return converted;
    }
}
