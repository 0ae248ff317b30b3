package io.huskytests.core.execution;

import io.huskytests.core.config.RuntimeEnvironment;
import io.huskytests.core.container.ContainerRunner;
import io.huskytests.core.container.ResultArtifactParser;

/**
 * Picks the execution strategy. Being inside the test container always wins,
 * even when design mode is set.
 */
public final class StrategySelector {

    private StrategySelector() {
    }

    public static StrategyKind select(boolean inContainer, boolean designMode) {
        if (inContainer) {
            return StrategyKind.CONTAINERIZED;
        }
        if (designMode) {
            return StrategyKind.INTERACTIVE;
        }
        return StrategyKind.GENERIC_RUNNER;
    }

    public static ExecutionStrategy create(ExecutionContext ctx, RuntimeEnvironment environment,
                                           ContainerRunner containerRunner) {
        StrategyKind kind = select(environment.isInContainer(), ctx.settings().designMode());
        switch (kind) {
            case CONTAINERIZED:
                return new ContainerizedStrategy(ctx, containerRunner, new ResultArtifactParser());
            case INTERACTIVE:
                return new InteractiveStrategy(ctx);
            default:
                return new GenericRunnerStrategy(ctx);
        }
    }
}
