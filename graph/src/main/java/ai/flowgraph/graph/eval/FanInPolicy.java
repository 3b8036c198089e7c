package ai.flowgraph.graph.eval;

/**
 * How an inlet with several sourced links picks its value.
 */
public enum FanInPolicy {
    /** The link with the highest creation serial wins. */
    LAST_WINS,
    /** Evaluation fails with {@link ai.flowgraph.graph.exceptions.AmbiguousSourceException}. */
    AMBIGUOUS
}
