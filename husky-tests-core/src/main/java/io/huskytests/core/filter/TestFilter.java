package io.huskytests.core.filter;

import io.huskytests.core.model.TestCase;

import java.util.Objects;

/**
 * Which tests to run.
 *
 * <p>A filter is exactly one of: a concrete expression, {@link #EMPTY} (run
 * everything) or {@link #NO_TESTS_FOUND} (run nothing). The two sentinels are
 * singletons and never compare equal to each other or to a concrete filter.
 */
public final class TestFilter {

    public enum Kind { CONCRETE, EMPTY, NO_TESTS_FOUND }

    public static final TestFilter EMPTY = new TestFilter(Kind.EMPTY, null);
    public static final TestFilter NO_TESTS_FOUND = new TestFilter(Kind.NO_TESTS_FOUND, null);

    private final Kind kind;
    private final FilterExpression expression;

    private TestFilter(Kind kind, FilterExpression expression) {
        this.kind = kind;
        this.expression = expression;
    }

    public static TestFilter of(FilterExpression expression) {
        return new TestFilter(Kind.CONCRETE, Objects.requireNonNull(expression, "expression"));
    }

    public Kind kind() { return kind; }
    public boolean isEmpty() { return kind == Kind.EMPTY; }
    public boolean isNoTestsFound() { return kind == Kind.NO_TESTS_FOUND; }

    /**
     * @return the expression of a concrete filter
     * @throws IllegalStateException for the sentinels
     */
    public FilterExpression expression() {
        if (kind != Kind.CONCRETE) {
            throw new IllegalStateException(kind + " filter has no expression");
        }
        return expression;
    }

    public boolean matches(TestCase testCase) {
        switch (kind) {
            case EMPTY:
                return true;
            case NO_TESTS_FOUND:
                return false;
            default:
                return expression.matches(testCase);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestFilter)) return false;
        TestFilter other = (TestFilter) o;
        return kind == Kind.CONCRETE && other.kind == Kind.CONCRETE && expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return kind == Kind.CONCRETE ? expression.hashCode() : System.identityHashCode(this);
    }

    @Override
    public String toString() {
        switch (kind) {
            case EMPTY:
                return "<empty>";
            case NO_TESTS_FOUND:
                return "<no tests found>";
            default:
                return expression.render();
        }
    }
}
