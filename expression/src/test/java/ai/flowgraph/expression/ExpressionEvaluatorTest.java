package ai.flowgraph.expression;

import org.junit.Assert;
import org.junit.Test;

import java.util.Map;

public class ExpressionEvaluatorTest {

    @Test
    public void integerArithmetic() throws ExpressionException {
        Assert.assertEquals(7L, ExpressionEvaluator.evaluate("1 + 2 * 3", Map.of()));
        Assert.assertEquals(9L, ExpressionEvaluator.evaluate("(1 + 2) * 3", Map.of()));
        Assert.assertEquals(-4L, ExpressionEvaluator.evaluate("-2 ** 2", Map.of()));
        Assert.assertEquals(512L, ExpressionEvaluator.evaluate("2 ** 3 ** 2", Map.of()));
        Assert.assertEquals(-4L, ExpressionEvaluator.evaluate("-7 // 2", Map.of()));
        Assert.assertEquals(1L, ExpressionEvaluator.evaluate("-7 % 2", Map.of()));
        Assert.assertEquals(-1L, ExpressionEvaluator.evaluate("(-1) ** 3", Map.of()));
    }

    @Test
    public void floatArithmetic() throws ExpressionException {
        Assert.assertEquals(2.5, ExpressionEvaluator.evaluate("5 / 2", Map.of()));
        Assert.assertEquals(3.0, ExpressionEvaluator.evaluate("1.5 * 2", Map.of()));
        Assert.assertEquals(0.5, ExpressionEvaluator.evaluate("2 ** -1", Map.of()));
        Assert.assertEquals(1500.0, ExpressionEvaluator.evaluate("1.5e3", Map.of()));
    }

    @Test
    public void overflowContinuesInDouble() throws ExpressionException {
        Object value = ExpressionEvaluator.evaluate("9223372036854775807 + 1", Map.of());
        Assert.assertTrue(value instanceof Double);
    }

    @Test
    public void negationKeepsIntegers() throws ExpressionException {
        Assert.assertEquals(Long.class, ExpressionEvaluator.evaluate("-5", Map.of()).getClass());
        Assert.assertEquals(-5L, ExpressionEvaluator.evaluate("-x", Map.of("x", 5L)));
        Assert.assertEquals(-9223372036854775807L, ExpressionEvaluator.evaluate("-9223372036854775807", Map.of()));
        Assert.assertEquals(-2.5, ExpressionEvaluator.evaluate("-2.5", Map.of()));
    }

    @Test
    public void floorDivisionOverflowContinuesInDouble() throws ExpressionException {
        Object value = ExpressionEvaluator.evaluate("x // -1", Map.of("x", Long.MIN_VALUE));
        Assert.assertEquals(9.223372036854775808E18, value);
        Assert.assertEquals(0L, ExpressionEvaluator.evaluate("x % -1", Map.of("x", Long.MIN_VALUE)));
    }

    @Test
    public void bindings() throws ExpressionException {
        Assert.assertEquals(11L, ExpressionEvaluator.evaluate("a * x + a", Map.of("a", 1L, "x", 10L)));
        Assert.assertEquals(2L, ExpressionEvaluator.evaluate("flag + flag", Map.of("flag", true)));
    }

    @Test
    public void text() throws ExpressionException {
        Assert.assertEquals("ab", ExpressionEvaluator.evaluate("'a' + \"b\"", Map.of()));
        Assert.assertEquals("xyxy", ExpressionEvaluator.evaluate("s * 2", Map.of("s", "xy")));
        Assert.assertEquals("it's", ExpressionEvaluator.evaluate("'it\\'s'", Map.of()));
        Assert.assertEquals("", ExpressionEvaluator.evaluate("'ab' * -2", Map.of()));
        Assert.assertEquals("", ExpressionEvaluator.evaluate("'' * 3000000000", Map.of()));
    }

    @Test
    public void oversizedRepetitionFails() {
        Assert.assertThrows(ExpressionException.class,
            () -> ExpressionEvaluator.evaluate("'a' * 3000000000", Map.of()));
        Assert.assertThrows(ExpressionException.class,
            () -> ExpressionEvaluator.evaluate("4294967297 * 'ab'", Map.of()));
    }

    @Test
    public void nullLiteral() throws ExpressionException {
        Assert.assertNull(ExpressionEvaluator.evaluate("None", Map.of()));
        Assert.assertNull(Literals.parse("null"));
        Assert.assertEquals(-3L, Literals.parse("-3"));
        Assert.assertThrows(ExpressionException.class, () -> Literals.parse("x"));
    }

    @Test
    public void failures() {
        Assert.assertThrows(ExpressionException.class, () -> ExpressionEvaluator.evaluate("1 / 0", Map.of()));
        Assert.assertThrows(ExpressionException.class, () -> ExpressionEvaluator.evaluate("1 // 0", Map.of()));
        Assert.assertThrows(ExpressionException.class, () -> ExpressionEvaluator.evaluate("None + 1", Map.of()));
        Assert.assertThrows(ExpressionException.class, () -> ExpressionEvaluator.evaluate("'a' - 'b'", Map.of()));
        Assert.assertThrows(ExpressionException.class, () -> ExpressionEvaluator.evaluate("x + 1", Map.of()));
        Assert.assertThrows(ExpressionException.class, () -> ExpressionEvaluator.evaluate("", Map.of()));
        Assert.assertThrows(ExpressionException.class, () -> ExpressionEvaluator.evaluate("(1 + 2", Map.of()));
        Assert.assertThrows(ExpressionException.class, () -> ExpressionEvaluator.evaluate("1 2", Map.of()));
        Assert.assertThrows(ExpressionException.class, () -> ExpressionEvaluator.evaluate("f(1)", Map.of()));
    }
}
