package ai.flowgraph.graph.exceptions;

/**
 * Structural mutation requested while change notifications are being dispatched.
 */
public class ReentrancyViolationException extends GraphException {

    public ReentrancyViolationException(String message) {
        super(message);
    }
}
