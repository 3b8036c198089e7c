package ai.flowgraph.graph.eval;

import ai.flowgraph.graph.model.GraphStore;
import ai.flowgraph.graph.model.Operator;
import org.junit.Assert;
import org.junit.Test;

public class ScriptBuilderTest {

    @Test
    public void sourcesFirstWithBoundNamesReplaced() throws Exception {
        final GraphStore store = new GraphStore();
        final Operator width = new Operator("width", "3");
        final Operator height = new Operator("height", "4");
        final Operator area = new Operator("area", "w * h + extra");
        store.appendOperator(area);
        store.appendOperator(width);
        store.appendOperator(height);
        store.appendLink(width.outlet(), area.inlets().get(0));
        store.appendLink(height.outlet(), area.inlets().get(1));

        final String script = new ScriptBuilder(store).build(area);

        Assert.assertEquals("width = 3\nheight = 4\narea = width * height + extra\n", script);
    }

    @Test
    public void singleOperator() throws Exception {
        final GraphStore store = new GraphStore();
        final Operator op = new Operator("n1", "x+y");
        store.appendOperator(op);

        Assert.assertEquals("n1 = x+y\n", new ScriptBuilder(store).build(op));
    }
}
