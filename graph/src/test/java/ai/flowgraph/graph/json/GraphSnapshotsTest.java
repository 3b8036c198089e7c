package ai.flowgraph.graph.json;

import ai.flowgraph.graph.eval.Evaluator;
import ai.flowgraph.graph.exceptions.InvalidTargetException;
import ai.flowgraph.graph.json.GraphSnapshot.LinkSnapshot;
import ai.flowgraph.graph.json.GraphSnapshot.OperatorSnapshot;
import ai.flowgraph.graph.model.GraphStore;
import ai.flowgraph.graph.model.Inlet;
import ai.flowgraph.graph.model.Link;
import ai.flowgraph.graph.model.Operator;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class GraphSnapshotsTest {

    @Test
    public void roundTripThroughJson() throws Exception {
        final GraphStore store = new GraphStore();
        final Operator a = new Operator("a", "5");
        final Operator b = new Operator("b", "6");
        final Operator sum = new Operator("sum", "x + y", List.of("x", "y"), "total");
        store.appendOperator(a);
        store.appendOperator(b);
        store.appendOperator(sum);
        store.appendLink(a.outlet(), sum.inlets().get(0));
        store.appendLink(null, sum.inlets().get(1));
        store.appendLink(b.outlet(), sum.inlets().get(1));

        final String json = GraphSnapshots.toJson(GraphSnapshots.capture(store));
        final GraphStore restored = GraphSnapshots.restore(GraphSnapshots.fromJson(json));

        final List<Operator> operators = restored.operators();
        Assert.assertEquals(List.of("a", "b", "sum"), operators.stream().map(Operator::name).toList());
        final Operator restoredSum = operators.get(2);
        Assert.assertEquals("x + y", restoredSum.expression());
        Assert.assertEquals(List.of("x", "y"), restoredSum.inlets().stream().map(Inlet::name).toList());
        Assert.assertEquals("total", restoredSum.outlet().name());
        Assert.assertEquals(3, restored.links().size());

        final List<Link> yLinks = restoredSum.inlets().get(1).links();
        Assert.assertTrue(yLinks.get(0).isPending());
        Assert.assertSame(operators.get(1), yLinks.get(1).source().operator());
        Assert.assertEquals(11L, new Evaluator(restored).evaluate(restoredSum).get());
    }

    @Test
    public void roundTripKeepsLinkRecency() throws Exception {
        final GraphStore store = new GraphStore();
        final Operator one = new Operator("one", "1");
        final Operator two = new Operator("two", "2");
        final Operator three = new Operator("three", "3");
        final Operator sink = new Operator("sink", "v");
        store.appendOperator(one);
        store.appendOperator(two);
        store.appendOperator(three);
        store.appendOperator(sink);
        final Inlet v = sink.inlets().get(0);
        store.appendLink(one.outlet(), v);
        store.insertLink(0, two.outlet(), v);
        store.insertLink(1, three.outlet(), v);
        Assert.assertEquals(3L, new Evaluator(store).evaluate(sink).get());

        final String json = GraphSnapshots.toJson(GraphSnapshots.capture(store));
        final GraphStore restored = GraphSnapshots.restore(GraphSnapshots.fromJson(json));

        final Operator restoredSink = restored.operators().get(3);
        final List<String> sources = restoredSink.inlets().get(0).links().stream()
            .map(link -> link.source().operator().name())
            .toList();
        Assert.assertEquals(List.of("two", "three", "one"), sources);
        Assert.assertEquals(3L, new Evaluator(restored).evaluate(restoredSink).get());

        store.removeLink(v.links().get(1));
        final GraphStore afterRemoval = GraphSnapshots.restore(GraphSnapshots.capture(store));
        Assert.assertEquals(2L, new Evaluator(afterRemoval).evaluate(afterRemoval.operators().get(3)).get());
    }

    @Test
    public void danglingReferenceIsRejectedBeforeRestoring() {
        final GraphSnapshot snapshot = new GraphSnapshot(
            List.of(new OperatorSnapshot("op-1", "a", "x", List.of("x"), "result")),
            List.of(new LinkSnapshot("op-1", 3, null, 0)));
        final GraphStore store = new GraphStore();

        Assert.assertThrows(InvalidTargetException.class, () -> GraphSnapshots.restore(snapshot, store));
        Assert.assertEquals(0, store.operatorCount());
    }
}
