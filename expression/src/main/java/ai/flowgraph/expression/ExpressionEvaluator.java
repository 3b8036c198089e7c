package ai.flowgraph.expression;

import ai.flowgraph.expression.Expr.BinaryOperator;

import java.util.Map;
import javax.annotation.Nullable;

/**
 * Evaluates parsed expressions over {@code Long}, {@code Double}, {@code Boolean}, {@code String}
 * and null values. Booleans take part in arithmetic as 1 and 0. Integer arithmetic that
 * overflows a long continues in double precision.
 */
public final class ExpressionEvaluator {
    static final int MAX_TEXT_LENGTH = 1 << 24;

    private ExpressionEvaluator() {}

    @Nullable
    public static Object evaluate(String text, Map<String, ?> bindings) throws ExpressionException {
        return evaluate(Parser.parse(text), bindings);
    }

    @Nullable
    public static Object evaluate(Expr expr, Map<String, ?> bindings) throws ExpressionException {
        if (expr instanceof Expr.Literal literal) {
            return literal.value();
        }
        if (expr instanceof Expr.Name name) {
            if (!bindings.containsKey(name.identifier())) {
                throw new ExpressionException("Name '" + name.identifier() + "' is not bound");
            }
            return bindings.get(name.identifier());
        }
        if (expr instanceof Expr.Unary unary) {
            return negate(unary.operator(), evaluate(unary.operand(), bindings));
        }
        if (expr instanceof Expr.Binary binary) {
            final Object left = evaluate(binary.left(), bindings);
            final Object right = evaluate(binary.right(), bindings);
            return apply(binary.operator(), left, right);
        }
        throw new IllegalStateException("Unknown expression node " + expr);
    }

    private static Object negate(String operator, @Nullable Object value) throws ExpressionException {
        final Number n = numeric(value, operator);
        if (operator.equals("+")) {
            return n;
        }
        if (n instanceof Double d) {
            return -d;
        }
        final long l = n.longValue();
        if (l == Long.MIN_VALUE) {
            return -(double) l;
        }
        return -l;
    }

    private static Object apply(BinaryOperator op, @Nullable Object left, @Nullable Object right)
        throws ExpressionException
    {
        if (left instanceof String || right instanceof String) {
            return applyText(op, left, right);
        }

        final Number a = numeric(left, op.symbol());
        final Number b = numeric(right, op.symbol());
        if (a instanceof Double || b instanceof Double || op == BinaryOperator.DIVIDE) {
            return applyDouble(op, a.doubleValue(), b.doubleValue());
        }
        try {
            return applyLong(op, a.longValue(), b.longValue());
        } catch (ArithmeticException e) {
            if (op == BinaryOperator.FLOOR_DIVIDE || op == BinaryOperator.MODULO) {
                throw new ExpressionException("Division by zero in '" + op.symbol() + "'");
            }
            return applyDouble(op, a.doubleValue(), b.doubleValue());
        }
    }

    private static Object applyLong(BinaryOperator op, long a, long b) throws ExpressionException {
        return switch (op) {
            case ADD -> Math.addExact(a, b);
            case SUBTRACT -> Math.subtractExact(a, b);
            case MULTIPLY -> Math.multiplyExact(a, b);
            case FLOOR_DIVIDE -> a == Long.MIN_VALUE && b == -1 ? (Object) (-(double) a) : (Object) Math.floorDiv(a, b);
            case MODULO -> Math.floorMod(a, b);
            case POWER -> b < 0 ? (Object) Math.pow(a, b) : (Object) power(a, b);
            case DIVIDE -> throw new IllegalStateException("True division is evaluated in double precision");
        };
    }

    private static long power(long base, long exponent) {
        if (exponent == 0) {
            return 1;
        }
        if (base == 0 || base == 1) {
            return base;
        }
        if (base == -1) {
            return exponent % 2 == 0 ? 1 : -1;
        }
        long result = 1;
        for (long i = 0; i < exponent; i++) {
            result = Math.multiplyExact(result, base);
        }
        return result;
    }

    private static Object applyDouble(BinaryOperator op, double a, double b) throws ExpressionException {
        if (b == 0 && (op == BinaryOperator.DIVIDE || op == BinaryOperator.FLOOR_DIVIDE
            || op == BinaryOperator.MODULO))
        {
            throw new ExpressionException("Division by zero in '" + op.symbol() + "'");
        }
        return switch (op) {
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE -> a / b;
            case FLOOR_DIVIDE -> Math.floor(a / b);
            case MODULO -> a - b * Math.floor(a / b);
            case POWER -> Math.pow(a, b);
        };
    }

    private static Object applyText(BinaryOperator op, @Nullable Object left, @Nullable Object right)
        throws ExpressionException
    {
        if (op == BinaryOperator.ADD && left instanceof String l && right instanceof String r) {
            return l + r;
        }
        if (op == BinaryOperator.MULTIPLY) {
            if (left instanceof String s && isInteger(right)) {
                return repeat(s, ((Number) right).longValue());
            }
            if (right instanceof String s && isInteger(left)) {
                return repeat(s, ((Number) left).longValue());
            }
        }
        throw new ExpressionException("Unsupported operand types for '%s': %s and %s"
            .formatted(op.symbol(), typeName(left), typeName(right)));
    }

    private static String repeat(String s, long count) throws ExpressionException {
        if (count <= 0 || s.isEmpty()) {
            return "";
        }
        if (count > MAX_TEXT_LENGTH / s.length()) {
            throw new ExpressionException("Repeating a string of length " + s.length() + " " + count
                + " times exceeds " + MAX_TEXT_LENGTH + " characters");
        }
        return s.repeat((int) count);
    }

    private static boolean isInteger(@Nullable Object value) {
        return value instanceof Long || value instanceof Integer;
    }

    private static Number numeric(@Nullable Object value, String operator) throws ExpressionException {
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (value instanceof Double || value instanceof Long) {
            return (Number) value;
        }
        if (value instanceof Number n) {
            return n instanceof Float ? (Number) n.doubleValue() : (Number) n.longValue();
        }
        throw new ExpressionException("Unsupported operand type for '%s': %s".formatted(operator, typeName(value)));
    }

    public static String typeName(@Nullable Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Long) {
            return "int";
        }
        if (value instanceof Double) {
            return "float";
        }
        if (value instanceof Boolean) {
            return "bool";
        }
        if (value instanceof String) {
            return "str";
        }
        return value.getClass().getSimpleName();
    }
}
