package ai.flowgraph.graph.exceptions;

/**
 * Operator could not be evaluated. These are expected outcomes, not faults of the graph.
 */
public abstract class EvaluationException extends GraphException {

    private final String operatorId;

    protected EvaluationException(String operatorId, String message) {
        super("operatorId=" + operatorId + ", " + message);
        this.operatorId = operatorId;
    }

    protected EvaluationException(String operatorId, String message, Throwable cause) {
        super("operatorId=" + operatorId + ", " + message, cause);
        this.operatorId = operatorId;
    }

    public String getOperatorId() {
        return operatorId;
    }
}
