package io.huskytests.core.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves each outcome against the known test cases by fully qualified name and
 * maps the engine result onto {@link TestOutcome}.
 */
public final class DefaultTestResultConverter implements TestResultConverter {

    private final Map<String, TestCase> casesByName = new LinkedHashMap<>();

    public DefaultTestResultConverter(Collection<TestCase> knownCases) {
        for (TestCase testCase : knownCases) {
            casesByName.putIfAbsent(testCase.fullyQualifiedName(), testCase);
        }
    }

    @Override
    public TestResult convert(TestCaseOutcome outcome) {
        String key = outcome.fullName().isBlank() ? outcome.name() : outcome.fullName();
        TestCase testCase = casesByName.get(key);
        if (testCase == null) {
            // Engine reported a case discovery never saw, e.g. a generated parameterization
            testCase = TestCase.of(key);
        }
        return new TestResult(
                testCase,
                mapOutcome(outcome.result(), outcome.label()),
                outcome.duration(),
                outcome.output(),
                outcome.failureMessage(),
                outcome.stackTrace());
    }

    static TestOutcome mapOutcome(String result, String label) {
        switch (result.toLowerCase(Locale.ROOT)) {
            case "passed":
            case "warning":
                return TestOutcome.PASSED;
            case "failed":
                return TestOutcome.FAILED;
            case "skipped":
                return "Ignored".equalsIgnoreCase(label) || "Explicit".equalsIgnoreCase(label)
                        ? TestOutcome.SKIPPED
                        : TestOutcome.NONE;
            default:
                return TestOutcome.NONE;
        }
    }
}
