package ai.flowgraph.expression;

import ai.flowgraph.expression.Expr.BinaryOperator;

import java.util.List;

/**
 * Recursive descent parser. Precedence, lowest first: {@code + -}, {@code * / // %}, unary
 * {@code + -}, {@code **} (right associative, binds tighter than a unary operator on its left).
 */
public final class Parser {
    private final String text;
    private final List<Token> tokens;
    private int pos = 0;

    private Parser(String text) {
        this.text = text;
        this.tokens = Tokenizer.tokenize(text);
    }

    public static Expr parse(String text) throws ExpressionException {
        final Parser parser = new Parser(text == null ? "" : text);
        final Expr expr = parser.additive();
        final Token rest = parser.peek();
        if (!rest.is(TokenType.END)) {
            throw parser.error(rest, "unexpected '" + rest.text() + "'");
        }
        return expr;
    }

    private Expr additive() throws ExpressionException {
        Expr left = multiplicative();
        while (true) {
            final BinaryOperator op = BinaryOperator.of(peek());
            if (op != BinaryOperator.ADD && op != BinaryOperator.SUBTRACT) {
                return left;
            }
            pos++;
            left = new Expr.Binary(op, left, multiplicative());
        }
    }

    private Expr multiplicative() throws ExpressionException {
        Expr left = unary();
        while (true) {
            final BinaryOperator op = BinaryOperator.of(peek());
            if (op != BinaryOperator.MULTIPLY && op != BinaryOperator.DIVIDE
                && op != BinaryOperator.FLOOR_DIVIDE && op != BinaryOperator.MODULO)
            {
                return left;
            }
            pos++;
            left = new Expr.Binary(op, left, unary());
        }
    }

    private Expr unary() throws ExpressionException {
        final Token token = peek();
        if (token.isOperator("-") || token.isOperator("+")) {
            pos++;
            return new Expr.Unary(token.text(), unary());
        }
        return power();
    }

    private Expr power() throws ExpressionException {
        final Expr base = primary();
        if (peek().isOperator("**")) {
            pos++;
            return new Expr.Binary(BinaryOperator.POWER, base, unary());
        }
        return base;
    }

    private Expr primary() throws ExpressionException {
        final Token token = peek();
        switch (token.type()) {
            case NUMBER -> {
                pos++;
                return new Expr.Literal(number(token));
            }
            case STRING -> {
                pos++;
                return new Expr.Literal(unquote(token.text()));
            }
            case IDENTIFIER -> {
                pos++;
                if (peek().is(TokenType.DOT) || peek().is(TokenType.LEFT_PAREN)) {
                    throw error(peek(), "attribute access and calls are not supported");
                }
                if (Literals.isKeyword(token.text())) {
                    return new Expr.Literal(Literals.keywordValue(token.text()).orElse(null));
                }
                return new Expr.Name(token.text());
            }
            case LEFT_PAREN -> {
                pos++;
                final Expr inner = additive();
                if (!peek().is(TokenType.RIGHT_PAREN)) {
                    throw error(peek(), "expected ')'");
                }
                pos++;
                return inner;
            }
            case END -> throw error(token, "unexpected end of expression");
            default -> throw error(token, "unexpected '" + token.text() + "'");
        }
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private ExpressionException error(Token token, String message) {
        return new ExpressionException("Syntax error in '%s' at %d: %s".formatted(text, token.start(), message));
    }

    private Object number(Token token) throws ExpressionException {
        final String s = token.text();
        try {
            if (s.indexOf('.') < 0 && s.indexOf('e') < 0 && s.indexOf('E') < 0) {
                try {
                    return Long.parseLong(s);
                } catch (NumberFormatException e) {
                    // does not fit into long
                    return Double.parseDouble(s);
                }
            }
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw error(token, "malformed number '" + s + "'");
        }
    }

    private static String unquote(String quoted) {
        final StringBuilder sb = new StringBuilder(quoted.length());
        for (int i = 1; i < quoted.length() - 1; i++) {
            char c = quoted.charAt(i);
            if (c == '\\' && i + 1 < quoted.length() - 1) {
                c = quoted.charAt(++i);
                switch (c) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(c);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
