package ai.flowgraph.expression;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the port names of an operator from its expression text.
 *
 * <p>A free variable is an identifier token that is not a keyword literal and does not follow a
 * {@code .} (attribute names belong to the object on their left). Resolution works on tokens only,
 * so it gives a best-effort answer for text the parser would reject and never throws.
 */
public final class PortResolver {
    private PortResolver() {}

    /**
     * Distinct free variables in order of first occurrence.
     */
    public static List<String> resolve(String expression) {
        final Set<String> names = new LinkedHashSet<>();
        for (Token token : freeVariables(Tokenizer.tokenize(expression))) {
            names.add(token.text());
        }
        return List.copyOf(names);
    }

    /**
     * Rewrites free variables according to {@code renames}; all other text, including spacing and
     * attribute names, is kept as written.
     */
    public static String rename(String expression, Map<String, String> renames) {
        if (expression == null || renames.isEmpty()) {
            return expression;
        }
        final StringBuilder sb = new StringBuilder(expression.length());
        int copied = 0;
        for (Token token : freeVariables(Tokenizer.tokenize(expression))) {
            final String replacement = renames.get(token.text());
            if (replacement != null) {
                sb.append(expression, copied, token.start()).append(replacement);
                copied = token.end();
            }
        }
        sb.append(expression, copied, expression.length());
        return sb.toString();
    }

    private static List<Token> freeVariables(List<Token> tokens) {
        final List<Token> result = new ArrayList<>();
        Token previous = null;
        for (Token token : tokens) {
            if (token.is(TokenType.IDENTIFIER)
                && !Literals.isKeyword(token.text())
                && (previous == null || !previous.is(TokenType.DOT)))
            {
                result.add(token);
            }
            previous = token;
        }
        return result;
    }
}
