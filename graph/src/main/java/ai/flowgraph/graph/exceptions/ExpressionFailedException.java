package ai.flowgraph.graph.exceptions;

import ai.flowgraph.expression.ExpressionException;

public class ExpressionFailedException extends EvaluationException {

    public ExpressionFailedException(String operatorId, ExpressionException cause) {
        super(operatorId, cause.getMessage(), cause);
    }
}
