package ai.flowgraph.projection;

/**
 * Receives projection changes. Called while the store rejects mutations, so implementations may
 * read the graph but not change it.
 */
public interface ChangeListener {
    void onChange(ChangeEvent event);
}
