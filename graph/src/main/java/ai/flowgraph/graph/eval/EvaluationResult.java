package ai.flowgraph.graph.eval;

import ai.flowgraph.graph.exceptions.EvaluationException;
import ai.flowgraph.graph.model.Operator;

import javax.annotation.Nullable;

/**
 * Outcome of evaluating one operator: either a value (possibly null) or the failure that
 * prevented computing it.
 */
public record EvaluationResult(
    Operator operator,
    @Nullable Object value,
    @Nullable EvaluationException error
) {
    public static EvaluationResult success(Operator operator, @Nullable Object value) {
        return new EvaluationResult(operator, value, null);
    }

    public static EvaluationResult failure(Operator operator, EvaluationException error) {
        return new EvaluationResult(operator, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    @Nullable
    public Object get() throws EvaluationException {
        if (error != null) {
            throw error;
        }
        return value;
    }

    @Override
    public String toString() {
        return operator.name() + " = " + (error == null ? value : "<" + error.getMessage() + ">");
    }
}
