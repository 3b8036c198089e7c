package ai.flowgraph.expression;

/**
 * Expression text could not be parsed or evaluated.
 */
public class ExpressionException extends Exception {

    public ExpressionException(String message) {
        super(message);
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
