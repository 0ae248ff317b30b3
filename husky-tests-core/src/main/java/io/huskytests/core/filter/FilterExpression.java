package io.huskytests.core.filter;

import io.huskytests.core.model.TestCase;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Boolean expression over test case properties.
 *
 * <p>Property names are matched case-insensitively; value comparisons ignore case.
 * A test case may carry several values for one property (traits), so
 * {@code =} and {@code ~} hold when any value matches, while {@code !=} and
 * {@code !~} hold when no value matches.
 */
public interface FilterExpression {

    boolean matches(TestCase testCase);

    /** Canonical text form, parseable by {@link ExternalFilterParser}. */
    String render();

    enum Operator {
        EQUALS("="),
        NOT_EQUALS("!="),
        CONTAINS("~"),
        NOT_CONTAINS("!~");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    record Condition(String property, Operator operator, String value) implements FilterExpression {

        public Condition {
            if (property == null || property.isBlank()) {
                throw new IllegalArgumentException("property must not be null or blank");
            }
            if (operator == null || value == null) {
                throw new IllegalArgumentException("operator and value are required");
            }
        }

        @Override
        public boolean matches(TestCase testCase) {
            List<String> values = testCase.propertyValues(property);
            switch (operator) {
                case EQUALS:
                    return values.stream().anyMatch(v -> v.equalsIgnoreCase(value));
                case NOT_EQUALS:
                    return values.stream().noneMatch(v -> v.equalsIgnoreCase(value));
                case CONTAINS:
                    return values.stream().anyMatch(v -> containsIgnoreCase(v, value));
                case NOT_CONTAINS:
                    return values.stream().noneMatch(v -> containsIgnoreCase(v, value));
                default:
                    throw new IllegalStateException("Unhandled operator " + operator);
            }
        }

        @Override
        public String render() {
            return escape(property) + operator.symbol() + escape(value);
        }

        private static boolean containsIgnoreCase(String haystack, String needle) {
            return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
        }
    }

    record AnyOf(List<FilterExpression> operands) implements FilterExpression {

        public AnyOf {
            operands = List.copyOf(operands);
            if (operands.isEmpty()) {
                throw new IllegalArgumentException("AnyOf needs at least one operand");
            }
        }

        @Override
        public boolean matches(TestCase testCase) {
            return operands.stream().anyMatch(o -> o.matches(testCase));
        }

        @Override
        public String render() {
            return operands.stream().map(FilterExpression::renderOperand).collect(Collectors.joining("|"));
        }
    }

    record AllOf(List<FilterExpression> operands) implements FilterExpression {

        public AllOf {
            operands = List.copyOf(operands);
            if (operands.isEmpty()) {
                throw new IllegalArgumentException("AllOf needs at least one operand");
            }
        }

        @Override
        public boolean matches(TestCase testCase) {
            return operands.stream().allMatch(o -> o.matches(testCase));
        }

        @Override
        public String render() {
            return operands.stream().map(FilterExpression::renderOperand).collect(Collectors.joining("&"));
        }
    }

    record Not(FilterExpression operand) implements FilterExpression {

        public Not {
            if (operand == null) {
                throw new IllegalArgumentException("operand must not be null");
            }
        }

        @Override
        public boolean matches(TestCase testCase) {
            return !operand.matches(testCase);
        }

        @Override
        public String render() {
            return "!(" + operand.render() + ")";
        }
    }

    private static String renderOperand(FilterExpression operand) {
        return operand instanceof Condition || operand instanceof Not
                ? operand.render()
                : "(" + operand.render() + ")";
    }

    /** Escapes the characters that carry meaning in filter text. */
    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (ExternalFilterParser.isSpecial(c)) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
