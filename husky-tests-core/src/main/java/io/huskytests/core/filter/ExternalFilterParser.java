package io.huskytests.core.filter;

import io.huskytests.core.filter.FilterExpression.AllOf;
import io.huskytests.core.filter.FilterExpression.AnyOf;
import io.huskytests.core.filter.FilterExpression.Condition;
import io.huskytests.core.filter.FilterExpression.Not;
import io.huskytests.core.filter.FilterExpression.Operator;
import io.huskytests.core.model.TestCase;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses caller-supplied filter text such as
 * {@code FullyQualifiedName~Checkout&(Category=Fast|Priority!=3)}.
 *
 * <p>Grammar, loosest binding first:
 * <pre>
 *   or        := and ('|' and)*
 *   and       := unary ('&amp;' unary)*
 *   unary     := '!' unary | '(' or ')' | condition
 *   condition := property op value | value
 *   op        := '=' | '!=' | '~' | '!~'
 * </pre>
 * A bare value is shorthand for {@code FullyQualifiedName~value}. A backslash
 * escapes the next character.
 */
public final class ExternalFilterParser {

    private static final String SPECIAL = "()|&=!~\\";

    private final String text;
    private int pos;

    private ExternalFilterParser(String text) {
        this.text = text;
    }

    public static FilterExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new FilterParseException("Filter is empty", String.valueOf(expression), 0);
        }
        ExternalFilterParser parser = new ExternalFilterParser(expression);
        FilterExpression result = parser.parseOr();
        parser.skipWhitespace();
        if (parser.pos < expression.length()) {
            throw parser.error("Unexpected '" + expression.charAt(parser.pos) + "'");
        }
        return result;
    }

    static boolean isSpecial(char c) {
        return SPECIAL.indexOf(c) >= 0;
    }

    private FilterExpression parseOr() {
        List<FilterExpression> operands = new ArrayList<>();
        operands.add(parseAnd());
        while (consume('|')) {
            operands.add(parseAnd());
        }
        return operands.size() == 1 ? operands.get(0) : new AnyOf(operands);
    }

    private FilterExpression parseAnd() {
        List<FilterExpression> operands = new ArrayList<>();
        operands.add(parseUnary());
        while (consume('&')) {
            operands.add(parseUnary());
        }
        return operands.size() == 1 ? operands.get(0) : new AllOf(operands);
    }

    private FilterExpression parseUnary() {
        if (consume('!')) {
            return new Not(parseUnary());
        }
        if (consume('(')) {
            FilterExpression inner = parseOr();
            if (!consume(')')) {
                throw error("Missing ')'");
            }
            return inner;
        }
        return parseCondition();
    }

    private FilterExpression parseCondition() {
        skipWhitespace();
        int start = pos;
        String property = readToken(true);
        Operator operator = readOperator();
        if (operator == null) {
            if (property.isEmpty()) {
                throw error("Expected a condition");
            }
            return new Condition(TestCase.FULLY_QUALIFIED_NAME, Operator.CONTAINS, property);
        }
        if (property.isEmpty()) {
            throw new FilterParseException("Missing property name", text, start);
        }
        String value = readToken(false);
        if (value.isEmpty()) {
            throw error("Missing value for '" + property + "'");
        }
        return new Condition(property, operator, value);
    }

    private String readToken(boolean stopAtOperator) {
        StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\') {
                if (pos + 1 >= text.length()) {
                    throw error("Dangling escape");
                }
                sb.append(text.charAt(pos + 1));
                pos += 2;
                continue;
            }
            if (c == '(' || c == ')' || c == '|' || c == '&') {
                break;
            }
            if (stopAtOperator && (c == '=' || c == '~' || c == '!')) {
                break;
            }
            sb.append(c);
            pos++;
        }
        return sb.toString().strip();
    }

    private Operator readOperator() {
        skipWhitespace();
        if (text.startsWith("!=", pos)) {
            pos += 2;
            return Operator.NOT_EQUALS;
        }
        if (text.startsWith("!~", pos)) {
            pos += 2;
            return Operator.NOT_CONTAINS;
        }
        if (text.startsWith("=", pos)) {
            pos++;
            return Operator.EQUALS;
        }
        if (text.startsWith("~", pos)) {
            pos++;
            return Operator.CONTAINS;
        }
        return null;
    }

    private boolean consume(char expected) {
        skipWhitespace();
        if (pos < text.length() && text.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private FilterParseException error(String message) {
        return new FilterParseException(message, text, pos);
    }
}
