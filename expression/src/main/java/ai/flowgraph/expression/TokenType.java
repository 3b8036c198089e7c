package ai.flowgraph.expression;

public enum TokenType {
    NUMBER,
    STRING,
    IDENTIFIER,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN,
    DOT,
    COMMA,
    UNKNOWN,
    END
}
