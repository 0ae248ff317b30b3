package io.huskytests.core.filter;

import io.huskytests.core.filter.FilterExpression.AllOf;
import io.huskytests.core.filter.FilterExpression.AnyOf;
import io.huskytests.core.filter.FilterExpression.Condition;
import io.huskytests.core.filter.FilterExpression.Not;
import io.huskytests.core.filter.FilterExpression.Operator;
import io.huskytests.core.model.TestCase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExternalFilterParserTest {

    private static final TestCase FAST_ADD = new TestCase("Calc.Tests.CalculatorTests.Adds", null,
            Map.of("Category", List.of("Fast", "Math"), "Priority", List.of("1")));
    private static final TestCase SLOW_DIVIDE = new TestCase("Calc.Tests.CalculatorTests.Divides", null,
            Map.of("Category", List.of("Slow")));

    @Test
    void parsesSingleCondition() {
        FilterExpression expr = ExternalFilterParser.parse("FullyQualifiedName=Calc.Tests.CalculatorTests.Adds");

        assertEquals(new Condition("FullyQualifiedName", Operator.EQUALS, "Calc.Tests.CalculatorTests.Adds"), expr);
        assertTrue(expr.matches(FAST_ADD));
        assertFalse(expr.matches(SLOW_DIVIDE));
    }

    @Test
    void andBindsTighterThanOr() {
        FilterExpression expr = ExternalFilterParser.parse("Category=Slow|Category=Fast&Priority=2");

        assertTrue(expr instanceof AnyOf);
        AnyOf or = (AnyOf) expr;
        assertEquals(2, or.operands().size());
        assertTrue(or.operands().get(1) instanceof AllOf);
        assertTrue(expr.matches(SLOW_DIVIDE));
        assertFalse(expr.matches(FAST_ADD), "Priority is 1, so the AND branch fails");
    }

    @Test
    void parenthesesOverridePrecedence() {
        FilterExpression expr = ExternalFilterParser.parse("(Category=Slow|Category=Fast)&Priority=1");

        assertTrue(expr instanceof AllOf);
        assertTrue(expr.matches(FAST_ADD));
        assertFalse(expr.matches(SLOW_DIVIDE));
    }

    @Test
    void supportsAllOperators() {
        assertTrue(ExternalFilterParser.parse("Name~add").matches(FAST_ADD));
        assertFalse(ExternalFilterParser.parse("Name!~add").matches(FAST_ADD));
        assertTrue(ExternalFilterParser.parse("Category!=Slow").matches(FAST_ADD));
        assertFalse(ExternalFilterParser.parse("Category!=Math").matches(FAST_ADD), "any matching trait value fails !=");
        assertTrue(ExternalFilterParser.parse("Priority!=3").matches(SLOW_DIVIDE), "absent trait satisfies !=");
    }

    @Test
    void negatesGroups() {
        FilterExpression expr = ExternalFilterParser.parse("!(Category=Slow)");

        assertEquals(new Not(new Condition("Category", Operator.EQUALS, "Slow")), expr);
        assertTrue(expr.matches(FAST_ADD));
        assertFalse(expr.matches(SLOW_DIVIDE));
    }

    @Test
    void bareValueMeansNameContains() {
        FilterExpression expr = ExternalFilterParser.parse("CalculatorTests.Div");

        assertEquals(new Condition(TestCase.FULLY_QUALIFIED_NAME, Operator.CONTAINS, "CalculatorTests.Div"), expr);
        assertTrue(expr.matches(SLOW_DIVIDE));
    }

    @Test
    void escapedCharactersArePartOfTheValue() {
        TestCase parameterized = TestCase.of("Calc.Tests.CalculatorTests.Adds(1,2)");
        FilterExpression expr = ExternalFilterParser.parse("FullyQualifiedName=Calc.Tests.CalculatorTests.Adds\\(1,2\\)");

        assertTrue(expr.matches(parameterized));
    }

    @Test
    void whitespaceAroundTokensIsIgnored() {
        FilterExpression expr = ExternalFilterParser.parse("  Category = Fast  |  Category = Slow ");

        assertTrue(expr.matches(FAST_ADD));
        assertTrue(expr.matches(SLOW_DIVIDE));
    }

    @Test
    void renderedFormParsesBackToTheSameExpression() {
        FilterExpression expr = ExternalFilterParser.parse("(Category=Fast|Name~a\\|b)&!(Priority=3)");

        assertEquals(expr, ExternalFilterParser.parse(expr.render()));
    }

    @Test
    void malformedFiltersAreRejected() {
        assertThrows(FilterParseException.class, () -> ExternalFilterParser.parse(""));
        assertThrows(FilterParseException.class, () -> ExternalFilterParser.parse("(Category=Fast"));
        assertThrows(FilterParseException.class, () -> ExternalFilterParser.parse("Category="));
        assertThrows(FilterParseException.class, () -> ExternalFilterParser.parse("=Fast"));
        assertThrows(FilterParseException.class, () -> ExternalFilterParser.parse("Category=Fast)"));
        assertThrows(FilterParseException.class, () -> ExternalFilterParser.parse("Name=abc\\"));
    }

    @Test
    void errorReportsPosition() {
        FilterParseException ex = assertThrows(FilterParseException.class,
                () -> ExternalFilterParser.parse("Category=Fast)"));

        assertEquals(13, ex.getPosition());
    }
}
