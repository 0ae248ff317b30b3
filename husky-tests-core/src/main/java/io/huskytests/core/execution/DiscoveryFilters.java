package io.huskytests.core.execution;

import io.huskytests.core.filter.TestFilter;
import io.huskytests.core.filter.TestFilterBuilder;
import io.huskytests.core.model.DiscoveredTestSet;

final class DiscoveryFilters {

    private DiscoveryFilters() {
    }

    /**
     * Rebuilds the filter from the loaded test cases, ignoring whatever filter came in.
     */
    static TestFilter rebuild(ExecutionContext ctx, DiscoveredTestSet discovery) {
        if (discovery.loadedTestCasesAboveLimit()) {
            ctx.runLog().debug("Setting filter to empty due to number of testcases");
            return TestFilter.EMPTY;
        }
        return new TestFilterBuilder(ctx.settings()).filterByList(discovery.loadedTestCases());
    }
}
