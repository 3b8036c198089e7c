package ai.flowgraph.graph.exceptions;

/**
 * Port name is malformed or already taken.
 */
public class InvalidNameException extends GraphException {

    public InvalidNameException(String message) {
        super(message);
    }
}
