package ai.flowgraph.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits expression text into tokens. Never fails: characters outside the grammar become
 * {@link TokenType#UNKNOWN} tokens, and so does an unterminated string literal (up to the end of
 * the text). The list always ends with a single {@link TokenType#END} token.
 */
public final class Tokenizer {
    private final String text;
    private int pos = 0;

    private Tokenizer(String text) {
        this.text = text;
    }

    public static List<Token> tokenize(String text) {
        return new Tokenizer(text == null ? "" : text).run();
    }

    private List<Token> run() {
        final List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                tokens.add(new Token(TokenType.END, "", pos, pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private Token next() {
        final int start = pos;
        final char c = text.charAt(pos);

        if (isIdentifierStart(c)) {
            pos++;
            while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
                pos++;
            }
            return token(TokenType.IDENTIFIER, start);
        }

        if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
            return number(start);
        }

        switch (c) {
            case '\'', '"' -> {
                return string(start, c);
            }
            case '(' -> {
                pos++;
                return token(TokenType.LEFT_PAREN, start);
            }
            case ')' -> {
                pos++;
                return token(TokenType.RIGHT_PAREN, start);
            }
            case '.' -> {
                pos++;
                return token(TokenType.DOT, start);
            }
            case ',' -> {
                pos++;
                return token(TokenType.COMMA, start);
            }
            case '*', '/' -> {
                pos++;
                if (peek(0) == c) {
                    pos++;
                }
                return token(TokenType.OPERATOR, start);
            }
            case '+', '-', '%' -> {
                pos++;
                return token(TokenType.OPERATOR, start);
            }
            default -> {
                pos++;
                return token(TokenType.UNKNOWN, start);
            }
        }
    }

    private Token number(int start) {
        while (Character.isDigit(peek(0))) {
            pos++;
        }
        if (peek(0) == '.' && !isIdentifierStart(peek(1))) {
            pos++;
            while (Character.isDigit(peek(0))) {
                pos++;
            }
        }
        final char e = peek(0);
        if (e == 'e' || e == 'E') {
            int offset = 1;
            if (peek(offset) == '+' || peek(offset) == '-') {
                offset++;
            }
            if (Character.isDigit(peek(offset))) {
                pos += offset;
                while (Character.isDigit(peek(0))) {
                    pos++;
                }
            }
        }
        return token(TokenType.NUMBER, start);
    }

    private Token string(int start, char quote) {
        pos++;
        while (pos < text.length()) {
            final char c = text.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            pos++;
            if (c == quote) {
                return token(TokenType.STRING, start);
            }
        }
        pos = text.length();
        return token(TokenType.UNKNOWN, start);
    }

    private Token token(TokenType type, int start) {
        return new Token(type, text.substring(start, pos), start, pos);
    }

    private char peek(int offset) {
        final int i = pos + offset;
        return i < text.length() ? text.charAt(i) : '\0';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
