package ai.flowgraph.projection;

public enum Attribute {
    NAME,
    /** Operators only. */
    EXPRESSION,
    /** Read only. */
    KIND,
    /** Links only; an outlet or null. */
    LINK_SOURCE
}
