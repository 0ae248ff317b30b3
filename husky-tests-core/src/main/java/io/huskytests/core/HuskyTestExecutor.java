package io.huskytests.core;

import io.huskytests.core.config.RuntimeEnvironment;
import io.huskytests.core.container.ContainerRunner;
import io.huskytests.core.engine.XmlDiagnosticDump;
import io.huskytests.core.execution.ExecutionContext;
import io.huskytests.core.execution.ExecutionStrategy;
import io.huskytests.core.execution.StrategySelector;
import io.huskytests.core.filter.TestFilter;
import io.huskytests.core.model.DiscoveredTestSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Main entry point: picks the execution strategy once and runs assemblies through it.
 *
 * <p>Usage:
 * <pre>{@code
 * ExecutionContext ctx = ExecutionContext.builder()
 *         .engineAdapter(engine)
 *         .recorder(frameworkHandle::record)
 *         .settings(RunnerSettings.builder().designMode(false).build())
 *         .build();
 * HuskyTestExecutor executor = new HuskyTestExecutor(ctx, RuntimeEnvironment.system(),
 *         new ContainerRunner(ContainerSettings.defaults(), new ProcessCommandExecutor()));
 * boolean ran = executor.runAssembly(TestFilter.EMPTY, discovery);
 * }</pre>
 */
public final class HuskyTestExecutor {

    private static final Logger log = LoggerFactory.getLogger(HuskyTestExecutor.class);

    private final ExecutionContext ctx;
    private final RuntimeEnvironment environment;
    private final ContainerRunner containerRunner;
    private ExecutionStrategy strategy;

    public HuskyTestExecutor(ExecutionContext ctx, RuntimeEnvironment environment, ContainerRunner containerRunner) {
        this.ctx = ctx;
        this.environment = environment;
        this.containerRunner = containerRunner;
    }

    /**
     * The strategy for this executor, selected on first use.
     */
    public synchronized ExecutionStrategy strategy() {
        if (strategy == null) {
            strategy = StrategySelector.create(ctx, environment, containerRunner);
            log.info("In container: {}, design mode: {} -> {} execution",
                    environment.isInContainer(), ctx.settings().designMode(), strategy.kind());
        }
        return strategy;
    }

    /**
     * Runs one test assembly.
     *
     * @return false when the run was skipped because nothing matched
     */
    public boolean runAssembly(TestFilter filter, DiscoveredTestSet discovery) {
        log.info("=== Husky Test Run ===");
        log.info("Assembly: {}", discovery.assemblyPath());
        log.info("Discovered test cases: {} (loaded: {})",
                discovery.allTestCases().size(), discovery.loadedTestCases().size());
        log.debug("Incoming filter: {}", filter);

        boolean ran = strategy().run(filter, discovery);

        if (ctx.settings().dumpXmlTestResults() && ctx.dump() instanceof XmlDiagnosticDump) {
            Path folder = ctx.resolveOutputFolder(discovery.assemblyPath());
            ((XmlDiagnosticDump) ctx.dump()).writeTo(folder, discovery.assemblyPath().getFileName().toString());
        }

        log.info("=== Result: {} ===", ran ? "executed" : "skipped");
        return ran;
    }
}
