package ai.flowgraph.graph.exceptions;

public class CycleDetectedException extends EvaluationException {

    public CycleDetectedException(String operatorId, String message) {
        super(operatorId, message);
    }
}
