package ai.flowgraph.expression;

import javax.annotation.Nullable;

/**
 * Syntax tree of the expression mini-grammar.
 */
public interface Expr {

    record Literal(@Nullable Object value) implements Expr {}

    record Name(String identifier) implements Expr {}

    record Unary(String operator, Expr operand) implements Expr {}

    record Binary(BinaryOperator operator, Expr left, Expr right) implements Expr {}

    enum BinaryOperator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        FLOOR_DIVIDE("//"),
        MODULO("%"),
        POWER("**");

        private final String symbol;

        BinaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        @Nullable
        static BinaryOperator of(Token token) {
            if (token.type() != TokenType.OPERATOR) {
                return null;
            }
            for (BinaryOperator op : values()) {
                if (op.symbol.equals(token.text())) {
                    return op;
                }
            }
            return null;
        }
    }
}
