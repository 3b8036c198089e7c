package ai.flowgraph.graph;

import ai.flowgraph.graph.config.GraphConfig;
import ai.flowgraph.graph.eval.Evaluator;
import ai.flowgraph.graph.eval.ScriptBuilder;
import ai.flowgraph.graph.model.GraphStore;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

@Factory
public class BeanFactory {

    @Singleton
    public GraphStore graphStore(GraphConfig config) {
        return new GraphStore(config.getOutletName());
    }

    @Singleton
    public Evaluator evaluator(GraphStore store, GraphConfig config) {
        return new Evaluator(store, config);
    }

    @Singleton
    public ScriptBuilder scriptBuilder(GraphStore store) {
        return new ScriptBuilder(store);
    }
}
