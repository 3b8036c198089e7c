package ai.flowgraph.graph.exceptions;

/**
 * Link source is neither a live outlet nor absent.
 */
public class InvalidSourceException extends GraphException {

    public InvalidSourceException(String message) {
        super(message);
    }
}
