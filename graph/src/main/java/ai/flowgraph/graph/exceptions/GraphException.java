package ai.flowgraph.graph.exceptions;

/**
 * Base of all recoverable graph errors. A store operation that throws one of these has not
 * changed any state.
 */
public abstract class GraphException extends Exception {

    protected GraphException(String message) {
        super(message);
    }

    protected GraphException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
