package io.huskytests.core.execution;

import io.huskytests.core.config.DiscoveryMethod;
import io.huskytests.core.config.RunnerSettings;
import io.huskytests.core.engine.XmlDiagnosticDump;
import io.huskytests.core.filter.ExternalFilterParser;
import io.huskytests.core.filter.ExternalTestFilter;
import io.huskytests.core.filter.TestFilter;
import io.huskytests.core.filter.TestFilterBuilder;
import io.huskytests.core.model.DiscoveredTestSet;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GenericRunnerStrategyTest {

    private final RecordingEngineAdapter engine = new RecordingEngineAdapter();
    private final DiscoveredTestSet current = Fixtures.discovery(DiscoveryMethod.CURRENT);
    private final TestFilter incoming = TestFilter.of(ExternalFilterParser.parse("Category=Fast"));

    private GenericRunnerStrategy strategy(RunnerSettings settings, String externalFilter) {
        ExternalTestFilter external = externalFilter == null ? null : ExternalTestFilter.of(externalFilter);
        return new GenericRunnerStrategy(Fixtures.context(settings, engine, external));
    }

    @Test
    void smallExternalFilterIsKept() {
        GenericRunnerStrategy strategy = strategy(RunnerSettings.builder().assemblySelectLimit(50).build(), "A|B|C");

        assertSame(incoming, strategy.reconcileFilter(incoming, current));
    }

    @Test
    void oversizedExternalFilterFindsNothing() {
        GenericRunnerStrategy strategy = strategy(RunnerSettings.builder().assemblySelectLimit(1).build(), "A|B|C");

        assertSame(TestFilter.NO_TESTS_FOUND, strategy.reconcileFilter(incoming, current));
    }

    @Test
    void clauseCountAtTheLimitIsKept() {
        GenericRunnerStrategy strategy = strategy(RunnerSettings.builder().assemblySelectLimit(3).build(), "A|B&C");

        assertSame(incoming, strategy.reconcileFilter(incoming, current));
    }

    @Test
    void nativeFilterModeSkipsTheSizeCheck() {
        RunnerSettings settings = RunnerSettings.builder().assemblySelectLimit(1).useNativeFilter(true).build();

        assertSame(incoming, strategy(settings, "A|B|C").reconcileFilter(incoming, current));
    }

    @Test
    void withoutExternalFilterTheLoadedCasesAreUsed() {
        RunnerSettings settings = RunnerSettings.builder().build();
        GenericRunnerStrategy strategy = strategy(settings, null);

        assertEquals(new TestFilterBuilder(settings).filterByList(current.loadedTestCases()),
                strategy.reconcileFilter(incoming, current));
        assertSame(TestFilter.EMPTY, strategy.reconcileFilter(TestFilter.EMPTY, current));
    }

    @Test
    void blankExternalFilterCountsAsAbsent() {
        RunnerSettings settings = RunnerSettings.builder().build();

        assertEquals(new TestFilterBuilder(settings).filterByList(current.loadedTestCases()),
                strategy(settings, "  ").reconcileFilter(incoming, current));
    }

    @Test
    void legacyDiscoveryPassesThrough() {
        GenericRunnerStrategy strategy = strategy(RunnerSettings.builder().assemblySelectLimit(1).build(), "A|B|C");

        assertSame(incoming, strategy.reconcileFilter(incoming, Fixtures.discovery(DiscoveryMethod.LEGACY)));
    }

    @Test
    void reconcileIsIdempotent() {
        List<GenericRunnerStrategy> strategies = List.of(
                strategy(RunnerSettings.builder().build(), null),
                strategy(RunnerSettings.builder().assemblySelectLimit(1).build(), "A|B|C"),
                strategy(RunnerSettings.builder().build(), "Category=Fast"));
        List<TestFilter> filters = List.of(TestFilter.EMPTY, TestFilter.NO_TESTS_FOUND, incoming);

        for (GenericRunnerStrategy strategy : strategies) {
            for (TestFilter filter : filters) {
                TestFilter once = strategy.reconcileFilter(filter, current);
                TestFilter twice = strategy.reconcileFilter(once, current);
                if (once.kind() == TestFilter.Kind.CONCRETE) {
                    assertEquals(once, twice);
                } else {
                    assertSame(once, twice);
                }
            }
        }
    }

    @Test
    void externalFilterIsConvertedAgainstDiscoveredCases() {
        RunnerSettings settings = RunnerSettings.builder().build();
        GenericRunnerStrategy strategy = strategy(settings, "Category=Slow");

        TestFilter resolved = strategy.checkExternalFilter(TestFilter.EMPTY, current);

        assertEquals(new TestFilterBuilder(settings).filterByList(List.of(Fixtures.DIVIDES)), resolved);
    }

    @Test
    void nativeModeConvertsTheExpressionDirectly() {
        GenericRunnerStrategy strategy = strategy(RunnerSettings.builder().useNativeFilter(true).build(), "Category=Slow");

        assertEquals(TestFilter.of(ExternalFilterParser.parse("Category=Slow")),
                strategy.checkExternalFilter(TestFilter.EMPTY, current));
    }

    @Test
    void legacyModeConvertsAgainstLoadedCases() {
        RunnerSettings settings = RunnerSettings.builder().discoveryMethod(DiscoveryMethod.LEGACY).useNativeFilter(true).build();
        GenericRunnerStrategy strategy = strategy(settings, "Category=Fast");

        assertEquals(new TestFilterBuilder(settings).filterByList(List.of(Fixtures.ADDS, Fixtures.SUBTRACTS)),
                strategy.checkExternalFilter(TestFilter.EMPTY, Fixtures.discovery(DiscoveryMethod.LEGACY)));
    }

    @Test
    void noExternalFilterLeavesTheFilterAlone() {
        assertSame(incoming, strategy(RunnerSettings.builder().build(), null).checkExternalFilter(incoming, current));
    }

    @Test
    void conversionIsRecordedInTheDump() {
        XmlDiagnosticDump dump = new XmlDiagnosticDump();
        ExecutionContext ctx = ExecutionContext.builder()
                .settings(RunnerSettings.builder().build())
                .engineAdapter(engine)
                .externalFilter(ExternalTestFilter.of("Category=Slow"))
                .dump(dump)
                .recorder(r -> { })
                .build();

        new GenericRunnerStrategy(ctx).checkExternalFilter(TestFilter.EMPTY, current);

        assertTrue(dump.contents().contains("ExternalFilter: Category=Slow"));
        assertTrue(dump.contents().contains("<ExternalFilter phase=\"(At Execution (ExternalFilter))\">"));
    }

    @Test
    void runSkipsWhenExternalFilterMatchesNothing() {
        GenericRunnerStrategy strategy = strategy(RunnerSettings.builder().build(), "Category=Flaky");

        assertFalse(strategy.run(TestFilter.EMPTY, current));
        assertEquals(0, engine.runCount());
    }

    @Test
    void runSkipsWhenExternalFilterIsOversized() {
        GenericRunnerStrategy strategy = strategy(RunnerSettings.builder().assemblySelectLimit(1).build(),
                "Category=Fast|Category=Slow");

        assertFalse(strategy.run(TestFilter.EMPTY, current));
        assertEquals(0, engine.runCount());
    }

    @Test
    void runInvokesTheEngineWithTheResolvedFilter() {
        RunnerSettings settings = RunnerSettings.builder().build();
        GenericRunnerStrategy strategy = strategy(settings, "Category=Slow");

        assertTrue(strategy.run(TestFilter.EMPTY, current));
        assertEquals(List.of(new TestFilterBuilder(settings).filterByList(List.of(Fixtures.DIVIDES))), engine.runFilters);
    }

    @Test
    void runWithoutExternalFilterUsesTheLoadedCases() {
        RunnerSettings settings = RunnerSettings.builder().build();

        assertTrue(strategy(settings, null).run(incoming, current));
        assertEquals(List.of(new TestFilterBuilder(settings).filterByList(current.loadedTestCases())), engine.runFilters);
    }

    @Test
    void runWithNothingLoadedIsSkipped() {
        DiscoveredTestSet nothingLoaded = new DiscoveredTestSet(current.assemblyPath(), current.allTestCases(), List.of(),
                DiscoveryMethod.CURRENT, false, current.currentConverter(), current.legacyConverter());

        assertFalse(strategy(RunnerSettings.builder().build(), null).run(incoming, nothingLoaded));
        assertEquals(0, engine.runCount());
    }
}
