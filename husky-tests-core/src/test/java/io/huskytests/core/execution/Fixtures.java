package io.huskytests.core.execution;

import io.huskytests.core.config.DiscoveryMethod;
import io.huskytests.core.config.RunnerSettings;
import io.huskytests.core.filter.ExternalTestFilter;
import io.huskytests.core.model.DiscoveredTestSet;
import io.huskytests.core.model.TestCase;
import io.huskytests.core.model.TestResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class Fixtures {

    static final TestCase ADDS = new TestCase("Calc.Tests.CalculatorTests.Adds", null, Map.of("Category", List.of("Fast")));
    static final TestCase SUBTRACTS = new TestCase("Calc.Tests.CalculatorTests.Subtracts", null, Map.of("Category", List.of("Fast")));
    static final TestCase DIVIDES = new TestCase("Calc.Tests.CalculatorTests.Divides", null, Map.of("Category", List.of("Slow")));

    private Fixtures() {
    }

    static DiscoveredTestSet discovery(Path assemblyPath, DiscoveryMethod method) {
        return DiscoveredTestSet.of(assemblyPath, List.of(ADDS, SUBTRACTS, DIVIDES), method);
    }

    static DiscoveredTestSet discovery(DiscoveryMethod method) {
        return discovery(Path.of("build", "Calc.Tests.dll"), method);
    }

    static ExecutionContext context(RunnerSettings settings, RecordingEngineAdapter engine,
                                    ExternalTestFilter external, List<TestResult> recorded) {
        return ExecutionContext.builder()
                .settings(settings)
                .engineAdapter(engine)
                .externalFilter(external)
                .recorder(recorded::add)
                .build();
    }

    static ExecutionContext context(RunnerSettings settings, RecordingEngineAdapter engine, ExternalTestFilter external) {
        return context(settings, engine, external, new ArrayList<>());
    }
}
