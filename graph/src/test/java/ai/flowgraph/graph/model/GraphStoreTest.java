package ai.flowgraph.graph.model;

import ai.flowgraph.graph.exceptions.InvalidNameException;
import ai.flowgraph.graph.exceptions.InvalidSourceException;
import ai.flowgraph.graph.exceptions.InvalidTargetException;
import ai.flowgraph.graph.exceptions.NotFoundException;
import ai.flowgraph.graph.exceptions.OutOfRangeException;
import ai.flowgraph.graph.exceptions.ReentrancyViolationException;
import ai.flowgraph.graph.exceptions.StructuralViolationException;
import org.hamcrest.MatcherAssert;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;

public class GraphStoreTest {
    private GraphStore store;

    @Before
    public void setUp() {
        store = new GraphStore();
    }

    private Operator add(String name, String expression) throws Exception {
        final Operator op = new Operator(name, expression);
        store.appendOperator(op);
        return op;
    }

    private static List<String> inletNames(Operator op) {
        return op.inlets().stream().map(Inlet::name).toList();
    }

    @Test
    public void inletsFollowExpression() throws Exception {
        final Operator op = add("sum", "a*x+a");

        Assert.assertEquals(List.of("a", "x"), inletNames(op));
        Assert.assertEquals("result", store.outlet(op).name());
        Assert.assertEquals(EntityKind.OPERATOR, op.kind());
        Assert.assertEquals(EntityKind.INLET, op.inlets().get(0).kind());
        Assert.assertEquals(EntityKind.OUTLET, op.outlet().kind());
    }

    @Test
    public void insertOperatorPositions() throws Exception {
        final Operator a = add("a", "1");
        final Operator c = add("c", "3");
        final Operator b = new Operator("b", "2");
        store.insertOperator(1, b);

        Assert.assertEquals(List.of(a, b, c), store.operators());
        Assert.assertEquals(1, store.indexOf(b));
        Assert.assertThrows(OutOfRangeException.class, () -> store.insertOperator(5, new Operator("d", "4")));
        Assert.assertThrows(OutOfRangeException.class, () -> store.insertOperator(-1, new Operator("d", "4")));
        Assert.assertThrows(StructuralViolationException.class, () -> store.insertOperator(0, b));
        Assert.assertEquals(3, store.operatorCount());
    }

    @Test
    public void removeOperatorCascadesLinks() throws Exception {
        final Operator a = add("a", "1");
        final Operator b = add("b", "x+y");
        final Operator c = add("c", "z");
        final Link ab = store.appendLink(a.outlet(), b.inlets().get(0));
        final Link bc = store.appendLink(b.outlet(), c.inlets().get(0));
        final Link ac = store.appendLink(a.outlet(), c.inlets().get(0));
        final Link pending = store.appendLink(null, b.inlets().get(1));

        store.removeOperator(b);

        Assert.assertEquals(List.of(a, c), store.operators());
        Assert.assertEquals(List.of(ac), store.links());
        Assert.assertFalse(store.contains(b));
        Assert.assertFalse(store.contains(b.inlets().get(0)));
        Assert.assertFalse(store.contains(ab));
        Assert.assertFalse(store.contains(bc));
        Assert.assertFalse(store.contains(pending));
        Assert.assertEquals(List.of(ac), store.outLinks(a.outlet()));
        Assert.assertEquals(List.of(ac), store.inLinks(c.inlets().get(0)));
        Assert.assertThrows(NotFoundException.class, () -> store.removeOperator(b));
    }

    @Test
    public void removeOperatorWithSelfLoop() throws Exception {
        final Operator a = add("a", "x");
        store.appendLink(a.outlet(), a.inlets().get(0));

        store.removeOperator(a);

        MatcherAssert.assertThat(store.links(), empty());
        MatcherAssert.assertThat(store.operators(), empty());
    }

    @Test
    public void keptInletSurvivesExpressionEdit() throws Exception {
        final Operator src = add("src", "1");
        final Operator op = add("op", "a+b");
        final Inlet a = op.inlets().get(0);
        final Link link = store.appendLink(src.outlet(), a);

        store.setExpression(op, "a+c");

        Assert.assertEquals(List.of("a", "c"), inletNames(op));
        Assert.assertSame(a, op.inlets().get(0));
        Assert.assertEquals(List.of(link), store.inLinks(a));
        Assert.assertSame(src.outlet(), link.source());
        Assert.assertEquals("a+c", store.expression(op));
    }

    @Test
    public void droppedInletTakesItsLinks() throws Exception {
        final Operator src = add("src", "1");
        final Operator op = add("op", "a+b");
        final Inlet b = op.inlets().get(1);
        final Link link = store.appendLink(src.outlet(), b);

        store.setExpression(op, "a");

        Assert.assertEquals(List.of("a"), inletNames(op));
        Assert.assertFalse(store.contains(b));
        Assert.assertFalse(store.contains(link));
        MatcherAssert.assertThat(store.outLinks(src.outlet()), empty());
    }

    @Test
    public void outletUntouchedByExpressionEdit() throws Exception {
        final Operator op = add("op", "a");
        final Operator sink = add("sink", "v");
        final Outlet outlet = op.outlet();
        final Link link = store.appendLink(outlet, sink.inlets().get(0));

        store.setExpression(op, "q*2");

        Assert.assertSame(outlet, op.outlet());
        Assert.assertEquals(List.of(link), store.outLinks(outlet));
    }

    @Test
    public void reorderKeepsIdentity() throws Exception {
        final Operator op = add("op", "a+b+c");
        final Inlet a = op.inlets().get(0);
        final Inlet c = op.inlets().get(2);

        final InletReconciliation plan = store.setExpression(op, "c+b+a");

        Assert.assertEquals(List.of("c", "b", "a"), inletNames(op));
        Assert.assertSame(c, op.inlets().get(0));
        Assert.assertSame(a, op.inlets().get(2));
        MatcherAssert.assertThat(plan.created(), empty());
        MatcherAssert.assertThat(plan.dropped(), empty());
        Assert.assertEquals(2, plan.moved().size());
    }

    @Test
    public void linkValidation() throws Exception {
        final Operator a = add("a", "1");
        final Operator b = add("b", "x");
        final Operator detached = new Operator("d", "y");

        Assert.assertThrows(InvalidTargetException.class, () -> store.appendLink(a.outlet(), detached.inlets().get(0)));
        Assert.assertThrows(InvalidSourceException.class, () -> store.appendLink(detached.outlet(), b.inlets().get(0)));
        Assert.assertThrows(OutOfRangeException.class, () -> store.insertLink(1, a.outlet(), b.inlets().get(0)));
        MatcherAssert.assertThat(store.links(), empty());

        final Link first = store.appendLink(a.outlet(), b.inlets().get(0));
        final Link second = store.insertLink(0, null, b.inlets().get(0));
        Assert.assertEquals(List.of(second, first), store.inLinks(b.inlets().get(0)));
        Assert.assertEquals(List.of(first, second), store.links());
        Assert.assertTrue(second.isPending());
        Assert.assertTrue(second.serial() > first.serial());
    }

    @Test
    public void setLinkSourceMovesOutgoingEntry() throws Exception {
        final Operator a = add("a", "1");
        final Operator b = add("b", "2");
        final Operator c = add("c", "x");
        final Link link = store.appendLink(null, c.inlets().get(0));

        store.setLinkSource(link, a.outlet());
        Assert.assertEquals(List.of(link), store.outLinks(a.outlet()));

        store.setLinkSource(link, b.outlet());
        MatcherAssert.assertThat(store.outLinks(a.outlet()), empty());
        Assert.assertEquals(List.of(link), store.outLinks(b.outlet()));

        store.setLinkSource(link, null);
        Assert.assertTrue(link.isPending());
        MatcherAssert.assertThat(store.outLinks(b.outlet()), empty());

        store.removeLink(link);
        Assert.assertThrows(NotFoundException.class, () -> store.setLinkSource(link, a.outlet()));
        Assert.assertThrows(NotFoundException.class, () -> store.removeLink(link));
    }

    @Test
    public void renameInletRewritesExpression() throws Exception {
        final Operator src = add("src", "1");
        final Operator op = add("op", "a * (a + b.size)");
        final Inlet a = op.inlets().get(0);
        final Link link = store.appendLink(src.outlet(), a);

        store.renameInlet(a, "w");

        Assert.assertEquals("w", a.name());
        Assert.assertEquals("w * (w + b.size)", op.expression());
        Assert.assertEquals(List.of(link), store.inLinks(a));
        Assert.assertEquals(List.of("w", "b"), inletNames(op));

        Assert.assertThrows(InvalidNameException.class, () -> store.renameInlet(a, "b"));
        Assert.assertThrows(InvalidNameException.class, () -> store.renameInlet(a, "None"));
        Assert.assertThrows(InvalidNameException.class, () -> store.renameInlet(a, "x y"));
        Assert.assertEquals("w * (w + b.size)", op.expression());
    }

    @Test
    public void mutationsRejectedWhileDispatching() throws Exception {
        final Operator a = add("a", "x");
        final ReentrancyViolationException[] caught = new ReentrancyViolationException[1];

        store.guard().dispatch(() -> {
            try {
                store.setName(a, "renamed");
            } catch (ReentrancyViolationException e) {
                caught[0] = e;
            } catch (NotFoundException e) {
                throw new AssertionError(e);
            }
        });

        Assert.assertNotNull(caught[0]);
        Assert.assertEquals("a", a.name());
        Assert.assertFalse(store.guard().isDispatching());
    }

    @Test
    public void readsRejectForeignEntities() {
        final Operator detached = new Operator("d", "y");

        Assert.assertThrows(NotFoundException.class, () -> store.inlets(detached));
        Assert.assertThrows(NotFoundException.class, () -> store.name(detached));
        Assert.assertThrows(NotFoundException.class, () -> store.inLinks(detached.inlets().get(0)));
        Assert.assertThrows(NotFoundException.class, () -> store.setExpression(detached, "z"));
        MatcherAssert.assertThat(List.of(store.contains(detached), store.contains(null)), contains(false, false));
    }

    @Test
    public void explicitInletsAreReconciledOnNextEdit() throws Exception {
        final Operator op = new Operator("op", "p+q", List.of("q", "r"), "out");
        store.appendOperator(op);
        final Inlet q = op.inlets().get(0);

        store.setExpression(op, "p+q");

        MatcherAssert.assertThat(inletNames(op), contains("p", "q"));
        Assert.assertSame(q, op.inlets().get(1));
        MatcherAssert.assertThat(List.of(op.outlet().name()), containsInAnyOrder("out"));
    }
}
