package ai.flowgraph.graph.eval;

public enum UnboundInletPolicy {
    FAIL,
    DEFAULT
}
