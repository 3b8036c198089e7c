package ai.flowgraph.expression;

import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Identifiers that denote constants rather than free variables.
 */
public final class Literals {
    private static final Object NULL = new Object();

    private static final Map<String, Object> KEYWORDS = Map.of(
        "None", NULL,
        "null", NULL,
        "True", Boolean.TRUE,
        "true", Boolean.TRUE,
        "False", Boolean.FALSE,
        "false", Boolean.FALSE
    );

    private Literals() {}

    public static boolean isKeyword(String identifier) {
        return KEYWORDS.containsKey(identifier);
    }

    /**
     * Value of a keyword literal; empty optional stands for the null literal.
     */
    static Optional<Object> keywordValue(String identifier) {
        final Object value = KEYWORDS.get(identifier);
        if (value == null) {
            throw new IllegalArgumentException("Not a keyword literal: " + identifier);
        }
        return value == NULL ? Optional.empty() : Optional.of(value);
    }

    /**
     * Parses a single literal (number, string, boolean or null) as written in an expression.
     */
    @Nullable
    public static Object parse(String text) throws ExpressionException {
        final Expr expr = Parser.parse(text);
        if (expr instanceof Expr.Literal literal) {
            return literal.value();
        }
        if (expr instanceof Expr.Unary unary && unary.operand() instanceof Expr.Literal) {
            return ExpressionEvaluator.evaluate(expr, Map.of());
        }
        throw new ExpressionException("Not a literal: '" + text + "'");
    }
}
