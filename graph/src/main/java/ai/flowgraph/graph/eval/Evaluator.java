package ai.flowgraph.graph.eval;

import ai.flowgraph.expression.ExpressionEvaluator;
import ai.flowgraph.expression.ExpressionException;
import ai.flowgraph.expression.Literals;
import ai.flowgraph.graph.config.GraphConfig;
import ai.flowgraph.graph.exceptions.AmbiguousSourceException;
import ai.flowgraph.graph.exceptions.CycleDetectedException;
import ai.flowgraph.graph.exceptions.EvaluationException;
import ai.flowgraph.graph.exceptions.ExpressionFailedException;
import ai.flowgraph.graph.exceptions.NotFoundException;
import ai.flowgraph.graph.exceptions.UnboundInletException;
import ai.flowgraph.graph.model.GraphStore;
import ai.flowgraph.graph.model.Inlet;
import ai.flowgraph.graph.model.Link;
import ai.flowgraph.graph.model.Operator;
import com.google.common.annotations.VisibleForTesting;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import javax.annotation.Nullable;

/**
 * Computes operator results by evaluating upstream operators first and binding their results to
 * the inlets. Each call to {@link #evaluate} computes an operator at most once; revisiting an
 * operator that is still being computed yields {@link CycleDetectedException} for that branch.
 */
public class Evaluator {
    private static final Logger LOG = LogManager.getLogger(Evaluator.class);

    private final GraphStore store;
    private final FanInPolicy fanIn;
    private final UnboundInletPolicy unboundInlets;
    @Nullable
    private final Object defaultValue;

    private int computations = 0;

    public Evaluator(GraphStore store) {
        this(store, FanInPolicy.LAST_WINS, UnboundInletPolicy.FAIL, null);
    }

    public Evaluator(GraphStore store, FanInPolicy fanIn, UnboundInletPolicy unboundInlets,
                     @Nullable Object defaultValue)
    {
        this.store = store;
        this.fanIn = fanIn;
        this.unboundInlets = unboundInlets;
        this.defaultValue = defaultValue;
    }

    public Evaluator(GraphStore store, GraphConfig config) {
        this(store, config.getEvaluation().getFanIn(), config.getEvaluation().getUnboundInlets(),
            parseDefault(config.getEvaluation().getDefaultValue()));
    }

    private static Object parseDefault(String literal) {
        try {
            return Literals.parse(literal);
        } catch (ExpressionException e) {
            throw new IllegalArgumentException("Invalid default value '" + literal + "': " + e.getMessage(), e);
        }
    }

    public EvaluationResult evaluate(Operator op) throws NotFoundException {
        if (!store.contains(op)) {
            throw new NotFoundException("Operator " + op + " is not in the graph");
        }
        final EvaluationResult result = new Session().evaluate(op);
        if (!result.isSuccess()) {
            LOG.warn("Evaluation of {} failed: {}", op.name(), result.error().getMessage());
        }
        return result;
    }

    /**
     * Results of every operator in store order, sharing one memo table.
     */
    public Map<Operator, EvaluationResult> evaluateAll() {
        final Session session = new Session();
        final Map<Operator, EvaluationResult> results = new LinkedHashMap<>();
        for (Operator op : store.operators()) {
            results.put(op, session.evaluate(op));
        }
        return results;
    }

    @VisibleForTesting
    int computations() {
        return computations;
    }

    private final class Session {
        private final Map<Operator, EvaluationResult> memo = new IdentityHashMap<>();
        private final Set<Operator> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());

        EvaluationResult evaluate(Operator op) {
            final EvaluationResult cached = memo.get(op);
            if (cached != null) {
                return cached;
            }
            if (!inProgress.add(op)) {
                LOG.debug("Cycle reached {}", op.name());
                return EvaluationResult.failure(op,
                    new CycleDetectedException(op.id(), "operator " + op.name() + " depends on itself"));
            }

            EvaluationResult result;
            try {
                result = compute(op);
            } finally {
                inProgress.remove(op);
            }
            computations++;
            memo.put(op, result);
            LOG.debug("Evaluated {}", result);
            return result;
        }

        private EvaluationResult compute(Operator op) {
            final Map<String, Object> bindings = new HashMap<>();
            try {
                for (Inlet inlet : op.inlets()) {
                    bindings.put(inlet.name(), valueOf(op, inlet));
                }
                return EvaluationResult.success(op, ExpressionEvaluator.evaluate(op.expression(), bindings));
            } catch (EvaluationException e) {
                return EvaluationResult.failure(op, e);
            } catch (ExpressionException e) {
                return EvaluationResult.failure(op, new ExpressionFailedException(op.id(), e));
            }
        }

        @Nullable
        private Object valueOf(Operator op, Inlet inlet) throws EvaluationException {
            final List<Link> sourced = Sources.sourced(inlet);
            if (sourced.isEmpty()) {
                if (unboundInlets == UnboundInletPolicy.DEFAULT) {
                    return defaultValue;
                }
                throw new UnboundInletException(op.id(), "inlet " + inlet.name() + " of " + op.name() + " is unbound");
            }
            if (sourced.size() > 1 && fanIn == FanInPolicy.AMBIGUOUS) {
                throw new AmbiguousSourceException(op.id(),
                    "inlet " + inlet.name() + " of " + op.name() + " has " + sourced.size() + " sources");
            }
            final Operator source = Objects.requireNonNull(Sources.latest(inlet)).operator();
            return evaluate(source).get();
        }
    }
}
