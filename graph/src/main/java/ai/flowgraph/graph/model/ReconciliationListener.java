package ai.flowgraph.graph.model;

import ai.flowgraph.common.IndexRange;

/**
 * Observes the steps of an inlet reconciliation. Removed runs are reported highest first with
 * ordinals of the list before the edit; inserted runs are reported lowest first with ordinals of
 * the final list. At every call the operator's inlet list is consistent with the runs reported so far.
 */
public interface ReconciliationListener {
    ReconciliationListener NONE = new ReconciliationListener() {};

    default void beforeRemove(Operator operator, IndexRange run) {}

    default void afterRemove(Operator operator, IndexRange run) {}

    default void beforeInsert(Operator operator, IndexRange run) {}

    default void afterInsert(Operator operator, IndexRange run) {}
}
