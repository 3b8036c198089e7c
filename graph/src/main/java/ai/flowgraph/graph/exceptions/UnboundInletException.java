package ai.flowgraph.graph.exceptions;

public class UnboundInletException extends EvaluationException {

    public UnboundInletException(String operatorId, String message) {
        super(operatorId, message);
    }
}
