package ai.flowgraph.graph.exceptions;

/**
 * Ordinal outside of the valid bounds.
 */
public class OutOfRangeException extends GraphException {

    public OutOfRangeException(String message) {
        super(message);
    }
}
