package ai.flowgraph.graph.exceptions;

public class AmbiguousSourceException extends EvaluationException {

    public AmbiguousSourceException(String operatorId, String message) {
        super(operatorId, message);
    }
}
