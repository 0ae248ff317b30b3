package io.huskytests.core.execution;

import io.huskytests.core.config.DiscoveryMethod;
import io.huskytests.core.container.ContainerRunner;
import io.huskytests.core.container.ResultArtifactParser;
import io.huskytests.core.filter.TestFilter;
import io.huskytests.core.model.DiscoveredTestSet;
import io.huskytests.core.model.TestCase;
import io.huskytests.core.model.TestCaseOutcome;
import io.huskytests.core.model.TestResult;
import io.huskytests.core.model.TestResultConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the tests in a freshly built container and reads the results back from
 * the file the container writes into a mounted directory.
 *
 * <p>Results only exist once the container has exited, so nothing is streamed
 * to the host while the tests run.
 */
public final class ContainerizedStrategy implements ExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(ContainerizedStrategy.class);

    private final ExecutionContext ctx;
    private final ContainerRunner containerRunner;
    private final ResultArtifactParser parser;

    public ContainerizedStrategy(ExecutionContext ctx, ContainerRunner containerRunner, ResultArtifactParser parser) {
        this.ctx = ctx;
        this.containerRunner = containerRunner;
        this.parser = parser;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.CONTAINERIZED;
    }

    /** The caller's filter is used as given. */
    @Override
    public TestFilter reconcileFilter(TestFilter filter, DiscoveredTestSet discovery) {
        return filter;
    }

    @Override
    public boolean run(TestFilter filter, DiscoveredTestSet discovery) {
        Path assemblyPath = discovery.assemblyPath().toAbsolutePath();
        Path assemblyDir = assemblyPath.getParent();
        if (assemblyDir == null) {
            throw new IllegalArgumentException("Assembly path has no containing directory: " + assemblyPath);
        }
        String assemblyName = assemblyPath.getFileName().toString();
        log.debug("Containerized run of {} with filter {}", assemblyName, reconcileFilter(filter, discovery));

        Path hostResultDir = containerRunner.prepareResultDirectory(assemblyDir);
        containerRunner.buildImage(assemblyDir);

        List<String> testNames = discovery.allTestCases().stream()
                .map(TestCase::fullyQualifiedName)
                .collect(Collectors.toList());
        long start = System.nanoTime();
        containerRunner.runTests(assemblyDir, assemblyName, hostResultDir, testNames);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        Path resultFile = containerRunner.locateResultArtifact(hostResultDir);
        List<TestCaseOutcome> outcomes = parser.parse(resultFile);
        log.info("Executed {} test(s) in {}ms", outcomes.size(), elapsedMs);

        TestResultConverter converter = discovery.converterFor(DiscoveryMethod.CURRENT);
        for (TestCaseOutcome outcome : outcomes) {
            TestResult result = converter.convert(outcome);
            log.debug("Recording {} as executed in {}ms with result {}",
                    outcome.name(), outcome.duration().toMillis(), outcome.result());
            ctx.recorder().recordResult(result);
        }

        try {
            Files.delete(resultFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to delete result file " + resultFile, e);
        }
        return true;
    }
}
