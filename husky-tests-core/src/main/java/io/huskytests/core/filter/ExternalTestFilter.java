package io.huskytests.core.filter;

/**
 * A filter expression handed in by the calling test runner, in its own syntax.
 */
public record ExternalTestFilter(String expression) {

    public static ExternalTestFilter of(String expression) {
        return new ExternalTestFilter(expression);
    }

    public boolean isEmpty() {
        return expression == null || expression.isBlank();
    }

    /**
     * Number of clauses in the raw expression, counted by splitting on {@code |} and {@code &}.
     */
    public int clauseCount() {
        return isEmpty() ? 0 : expression.split("[|&]", -1).length;
    }

    public FilterExpression parse() {
        return ExternalFilterParser.parse(expression);
    }
}
