package ai.flowgraph.expression;

/**
 * Lexical token; {@code start} and {@code end} are offsets into the source text, end exclusive.
 */
public record Token(TokenType type, String text, int start, int end) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isOperator(String symbol) {
        return type == TokenType.OPERATOR && text.equals(symbol);
    }
}
