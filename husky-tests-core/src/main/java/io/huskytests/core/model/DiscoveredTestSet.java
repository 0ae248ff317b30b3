package io.huskytests.core.model;

import io.huskytests.core.config.DiscoveryMethod;

import java.nio.file.Path;
import java.util.List;

/**
 * Test cases known before execution begins, as produced by discovery.
 *
 * @param assemblyPath              path of the test binary under test
 * @param allTestCases              every discovered test case
 * @param loadedTestCases           cases selected by the caller for this run
 * @param discoveryMethod           how the cases were discovered
 * @param loadedTestCasesAboveLimit true when the loaded case count exceeded the discovery ceiling
 * @param currentConverter          result converter for {@link DiscoveryMethod#CURRENT}
 * @param legacyConverter           result converter for {@link DiscoveryMethod#LEGACY}
 */
public record DiscoveredTestSet(
        Path assemblyPath,
        List<TestCase> allTestCases,
        List<TestCase> loadedTestCases,
        DiscoveryMethod discoveryMethod,
        boolean loadedTestCasesAboveLimit,
        TestResultConverter currentConverter,
        TestResultConverter legacyConverter
) {

    public DiscoveredTestSet {
        if (assemblyPath == null) {
            throw new IllegalArgumentException("assemblyPath must not be null");
        }
        allTestCases = List.copyOf(allTestCases);
        loadedTestCases = List.copyOf(loadedTestCases);
    }

    /**
     * A set whose loaded cases are all discovered cases, converting results against them.
     */
    public static DiscoveredTestSet of(Path assemblyPath, List<TestCase> testCases, DiscoveryMethod method) {
        DefaultTestResultConverter converter = new DefaultTestResultConverter(testCases);
        return new DiscoveredTestSet(assemblyPath, testCases, testCases, method, false, converter, converter);
    }

    public boolean isDiscoveryMethodCurrent() {
        return discoveryMethod == DiscoveryMethod.CURRENT;
    }

    public TestResultConverter converterFor(DiscoveryMethod method) {
        return method == DiscoveryMethod.CURRENT ? currentConverter : legacyConverter;
    }
}
