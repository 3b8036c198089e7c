package ai.flowgraph.projection;

import ai.flowgraph.graph.config.GraphConfig;
import ai.flowgraph.graph.model.GraphStore;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

@Factory
public class BeanFactory {

    @Singleton
    public GraphTreeModel graphTreeModel(GraphStore store, GraphConfig config) {
        return new GraphTreeModel(store, config);
    }
}
