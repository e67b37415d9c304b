package io.github.eutro.procnet.core.passes.elab;

import io.github.eutro.procnet.core.ssa.ProcTemplate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProcIdFactoryTest {
    private final ProcTemplate top = new ProcTemplate("Top");
    private final ProcTemplate c = new ProcTemplate("C");
    private final ProcTemplate d = new ProcTemplate("D");

    @Test
    void testInstancesCounted() {
        ProcIdFactory factory = new ProcIdFactory();
        ProcId root = factory.createProcId(ProcId.EMPTY, top, true);
        ProcId first = factory.createProcId(root, c, true);
        ProcId second = factory.createProcId(root, c, true);

        assertEquals("Top:0", root.toString());
        assertEquals("Top:0->C:0", first.toString());
        assertEquals("Top:0->C:1", second.toString());
        assertNotEquals(first, second);
        assertEquals(2, second.depth());
        assertSame(c, second.getInstanceStack().get(1).template);
        assertEquals(1, second.getInstanceStack().get(1).instance);
    }

    @Test
    void testRedescentNotCounted() {
        ProcIdFactory factory = new ProcIdFactory();
        ProcId root = factory.createProcId(ProcId.EMPTY, top, true);
        ProcId peek = factory.createProcId(root, c, false);
        ProcId first = factory.createProcId(root, c, true);
        ProcId again = factory.createProcId(root, c, false);

        assertEquals(peek, first);
        assertEquals("Top:0->C:1", again.toString());
    }

    @Test
    void testCountersPerCallSite() {
        ProcIdFactory factory = new ProcIdFactory();
        ProcId root = factory.createProcId(ProcId.EMPTY, top, true);
        ProcId c0 = factory.createProcId(root, c, true);
        ProcId c1 = factory.createProcId(root, c, true);

        assertEquals("Top:0->D:0", factory.createProcId(root, d, true).toString());
        assertEquals("Top:0->C:0->D:0", factory.createProcId(c0, d, true).toString());
        assertEquals("Top:0->C:1->D:0", factory.createProcId(c1, d, true).toString());
        assertEquals("Top:0->C:0->D:1", factory.createProcId(c0, d, true).toString());
    }

    @Test
    void testFreshFactoryStartsOver() {
        ProcId a = new ProcIdFactory().createProcId(ProcId.EMPTY, top, true);
        ProcId b = new ProcIdFactory().createProcId(ProcId.EMPTY, top, true);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void testContains() {
        ProcIdFactory factory = new ProcIdFactory();
        ProcId id = factory.createProcId(factory.createProcId(ProcId.EMPTY, top, true), c, true);
        assertTrue(id.contains(top));
        assertTrue(id.contains(c));
        assertFalse(id.contains(d));
        // identity, not name
        assertFalse(id.contains(new ProcTemplate("C")));
        assertEquals(0, ProcId.EMPTY.depth());
    }
}
