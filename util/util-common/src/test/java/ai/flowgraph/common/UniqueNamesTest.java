package ai.flowgraph.common;

import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class UniqueNamesTest {

    @Test
    public void firstFreeSuffix() {
        Assert.assertEquals("n1", UniqueNames.next("n", List.of()));
        Assert.assertEquals("n3", UniqueNames.next("n", List.of("n1", "n2", "x")));
        Assert.assertEquals("n2", UniqueNames.next("n", List.of("n1", "n3")));
    }

    @Test
    public void randomIds() {
        var ids = new RandomIdGenerator(8);
        var id = ids.generate("op");
        Assert.assertTrue(id.matches("op-[0-9a-z]{8}"));
        Assert.assertNotEquals(id, ids.generate("op"));
    }
}
