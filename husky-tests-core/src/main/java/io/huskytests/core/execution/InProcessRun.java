package io.huskytests.core.execution;

import io.huskytests.core.engine.EngineRunResult;
import io.huskytests.core.engine.ResultForwardingListener;
import io.huskytests.core.engine.TestEngineAdapter;
import io.huskytests.core.filter.TestFilter;
import io.huskytests.core.model.DiscoveredTestSet;
import io.huskytests.core.model.TestResultConverter;

/**
 * The shared in-process run used by the interactive and generic-runner strategies.
 *
 * <p>Reconciles the filter with the calling strategy, streams each finished test
 * to the host while the engine runs, then writes the XML result file.
 */
public final class InProcessRun {

    private InProcessRun() {
    }

    /**
     * @return always true; a cancelled run still counts as having run
     */
    public static boolean run(ExecutionStrategy strategy, ExecutionContext ctx,
                              TestFilter filter, DiscoveredTestSet discovery) {
        TestFilter reconciled = strategy.reconcileFilter(filter, discovery);
        if (ctx.dump() != null) {
            ctx.dump().startExecution(reconciled, "(At Execution)");
        }

        TestResultConverter converter = discovery.converterFor(ctx.settings().discoveryMethod());
        TestEngineAdapter engine = ctx.engineAdapter();

        try (ResultForwardingListener listener = new ResultForwardingListener(converter, ctx.recorder())) {
            EngineRunResult result = engine.run(listener, reconciled);
            if (result.isCancelled()) {
                ctx.runLog().debug("   Run cancelled, {} result(s) forwarded", listener.forwardedCount());
                return true;
            }
            engine.generateTestOutput(result, discovery.assemblyPath(), ctx.resolveOutputFolder(discovery.assemblyPath()));
        } catch (NullPointerException e) {
            // Engines without a cancelled outcome fail this way when the run is stopped mid-flight
            if (!engine.isCancellationRequested()) {
                throw e;
            }
            ctx.runLog().debug("   Null ref caught after cancellation was requested");
        }
        return true;
    }
}
