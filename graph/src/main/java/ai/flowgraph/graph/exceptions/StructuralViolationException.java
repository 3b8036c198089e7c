package ai.flowgraph.graph.exceptions;

/**
 * Edit is incompatible with the shape of the graph or of its tree projection.
 */
public class StructuralViolationException extends GraphException {

    public StructuralViolationException(String message) {
        super(message);
    }
}
