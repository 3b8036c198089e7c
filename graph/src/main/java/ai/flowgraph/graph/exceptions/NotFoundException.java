package ai.flowgraph.graph.exceptions;

/**
 * Referenced operator, port or link is not part of the graph.
 */
public class NotFoundException extends GraphException {

    public NotFoundException(String message) {
        super(message);
    }
}
