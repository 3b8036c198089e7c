package ai.flowgraph.projection;

import ai.flowgraph.graph.model.GraphStore;
import io.micronaut.context.ApplicationContext;
import org.junit.Assert;
import org.junit.Test;

import java.util.Map;

public class BeanFactoryTest {

    @Test
    public void modelUsesConfiguredOperatorDefaults() throws Exception {
        try (ApplicationContext context = ApplicationContext.run(Map.of(
            "flowgraph.operators.default-expression", "a * b * c",
            "flowgraph.operators.name-prefix", "op")))
        {
            final GraphTreeModel model = context.getBean(GraphTreeModel.class);
            Assert.assertSame(context.getBean(GraphStore.class), model.store());

            model.insertAt(TreePath.ROOT, 0, 2);

            Assert.assertEquals("op2", model.getAttribute(TreePath.of(1), Attribute.NAME));
            Assert.assertEquals("a * b * c", model.getAttribute(TreePath.of(0), Attribute.EXPRESSION));
            Assert.assertEquals(4, model.childCount(TreePath.of(0)));
        }
    }
}
