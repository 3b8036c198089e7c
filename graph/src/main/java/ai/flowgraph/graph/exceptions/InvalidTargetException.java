package ai.flowgraph.graph.exceptions;

/**
 * Link target is not a live inlet.
 */
public class InvalidTargetException extends GraphException {

    public InvalidTargetException(String message) {
        super(message);
    }
}
