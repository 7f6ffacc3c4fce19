package work.cellium.kernel.demo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ExpressionEvaluatorTest {
    @Test
    void honoursPrecedenceAndParentheses() {
        assertEquals(7.0, ExpressionEvaluator.evaluate("1 + 2 * 3"));
        assertEquals(9.0, ExpressionEvaluator.evaluate("(1 + 2) * 3"));
        assertEquals(-4.0, ExpressionEvaluator.evaluate("-(2 + 2)"));
        assertEquals(2.5, ExpressionEvaluator.evaluate("10 / 4"));
    }

    @Test
    void ignoresCharactersOutsideTheGrammar() {
        assertEquals(3.0, ExpressionEvaluator.evaluate("1 + 2; rm -rf x"));
    }

    @Test
    void formatsIntegralResultsWithoutFraction() {
        assertEquals("6", ExpressionEvaluator.format(6.0));
        assertEquals("0.5", ExpressionEvaluator.format(0.5));
    }

    @Test
    void reportsErrors() {
        assertThrows(ArithmeticException.class, () -> ExpressionEvaluator.evaluate("1/0"));
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("(1+2"));
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("abc"));
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("1.2.3"));
    }

    @Test
    void rejectsExcessiveNesting() {
        int limit = ExpressionEvaluator.MAX_DEPTH;
        assertEquals(1.0, ExpressionEvaluator.evaluate("(".repeat(limit) + "1" + ")".repeat(limit)));
        var deep = assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("(".repeat(200_000) + "1"));
        assertEquals("expression nested too deeply", deep.getMessage());
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("-".repeat(limit + 1) + "1"));
    }
}
