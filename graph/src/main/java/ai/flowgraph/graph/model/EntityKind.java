package ai.flowgraph.graph.model;

public enum EntityKind {
    OPERATOR,
    INLET,
    OUTLET,
    LINK
}
