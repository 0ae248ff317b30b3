package io.huskytests.core.filter;

import io.huskytests.core.config.RunnerSettings;
import io.huskytests.core.filter.FilterExpression.AnyOf;
import io.huskytests.core.filter.FilterExpression.Condition;
import io.huskytests.core.filter.FilterExpression.Operator;
import io.huskytests.core.model.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds {@link TestFilter}s from a list of test cases or from a caller-supplied
 * {@link ExternalTestFilter}. All operations are pure.
 */
public final class TestFilterBuilder {

    private static final Logger log = LoggerFactory.getLogger(TestFilterBuilder.class);

    private final RunnerSettings settings;

    public TestFilterBuilder(RunnerSettings settings) {
        this.settings = settings;
    }

    /**
     * Selects exactly the given test cases.
     *
     * @return {@link TestFilter#NO_TESTS_FOUND} for an empty list,
     *         {@link TestFilter#EMPTY} when the list is larger than the assembly select limit
     */
    public TestFilter filterByList(List<TestCase> testCases) {
        if (testCases.isEmpty()) {
            return TestFilter.NO_TESTS_FOUND;
        }
        if (testCases.size() > settings.assemblySelectLimit()) {
            log.debug("{} test cases exceed assemblySelectLimit {}; running the whole assembly",
                    testCases.size(), settings.assemblySelectLimit());
            return TestFilter.EMPTY;
        }
        Set<String> names = new LinkedHashSet<>();
        for (TestCase testCase : testCases) {
            names.add(testCase.fullyQualifiedName());
        }
        List<FilterExpression> conditions = new ArrayList<>(names.size());
        for (String name : names) {
            conditions.add(new Condition(TestCase.FULLY_QUALIFIED_NAME, Operator.EQUALS, name));
        }
        return TestFilter.of(conditions.size() == 1 ? conditions.get(0) : new AnyOf(conditions));
    }

    /**
     * Converts the external filter directly into a native filter.
     */
    public TestFilter convertExternalFilterToFilter(ExternalTestFilter externalFilter) {
        if (externalFilter == null || externalFilter.isEmpty()) {
            return TestFilter.EMPTY;
        }
        return TestFilter.of(externalFilter.parse());
    }

    /**
     * Evaluates the external filter against already loaded test cases and selects the matches.
     */
    public TestFilter convertExternalFilterToFilter(ExternalTestFilter externalFilter, List<TestCase> loadedTestCases) {
        if (externalFilter == null || externalFilter.isEmpty()) {
            return TestFilter.EMPTY;
        }
        FilterExpression expression = externalFilter.parse();
        List<TestCase> matches = new ArrayList<>();
        for (TestCase testCase : loadedTestCases) {
            if (expression.matches(testCase)) {
                matches.add(testCase);
            }
        }
        log.debug("External filter matched {} of {} loaded test cases", matches.size(), loadedTestCases.size());
        return matches.isEmpty() ? TestFilter.NO_TESTS_FOUND : filterByList(matches);
    }
}
