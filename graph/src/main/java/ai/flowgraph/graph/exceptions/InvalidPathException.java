package ai.flowgraph.graph.exceptions;

/**
 * Path does not address an entity of the tree projection.
 */
public class InvalidPathException extends GraphException {

    public InvalidPathException(String message) {
        super(message);
    }
}
