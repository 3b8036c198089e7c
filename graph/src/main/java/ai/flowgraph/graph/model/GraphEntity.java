package ai.flowgraph.graph.model;

/**
 * Stable handle of an operator, port or link. Handles compare by identity; a handle whose entity
 * was removed from its store stays invalid even if an equal-looking entity is added later.
 */
public interface GraphEntity {
    String id();

    EntityKind kind();
}
