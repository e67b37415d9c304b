package io.github.eutro.procnet.core.ssa;

import io.github.eutro.procnet.core.ops.ChannelOps;
import io.github.eutro.procnet.core.types.BitsType;
import io.github.eutro.procnet.core.types.ChannelType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ModuleTest {
    @Test
    void testNamespaces() {
        Module module = new Module();
        FlatChannel chan = module.add(new FlatChannel("a", BitsType.BIT));
        ProcTemplate template = module.add(new ProcTemplate("a"));

        assertSame(chan, module.lookup("a"));
        assertSame(chan, module.lookupChannel("a"));
        assertSame(template, module.lookupTemplate("a"));
        assertThrows(IllegalArgumentException.class, () -> module.add(new ElaboratedProc("a")));
        assertThrows(IllegalArgumentException.class, () -> module.add(new ProcTemplate("a")));
        assertThrows(IllegalArgumentException.class, () -> new Module().add(chan));

        module.add(new ElaboratedProc("p"));
        assertNull(module.lookupChannel("p"));
        assertNotNull(module.lookup("p"));
    }

    @Test
    void testInsertBeforeAndErase() {
        Module module = new Module();
        ProcTemplate first = module.add(new ProcTemplate("first"));
        ProcTemplate second = module.add(new ProcTemplate("second"));
        module.insertBefore(second, new FlatChannel("c", BitsType.BIT));
        module.insertBefore(second, new ElaboratedProc("p"));

        List<ProcTemplate> templates = module.getSymbols(ProcTemplate.class);
        assertEquals(Arrays.asList(first, second), templates);
        assertEquals(4, module.getSymbols().size());
        assertEquals("c", module.getSymbols().get(1).getName());
        assertEquals("p", module.getSymbols().get(2).getName());

        assertEquals(2, module.eraseAll(ProcTemplate.class));
        assertNull(module.lookupTemplate("first"));
        assertEquals(2, templates.size());
        assertThrows(IllegalArgumentException.class,
                () -> module.insertBefore(first, new FlatChannel("d", BitsType.BIT)));

        // erased symbols can be added again
        module.add(first);
        assertTrue(module.erase(first));
        assertFalse(module.erase(first));
    }

    @Test
    void testDiagnosticsNeedAModule() {
        ProcTemplate loose = new ProcTemplate("loose");
        assertThrows(IllegalStateException.class, () -> loose.emitError("oops"));
    }

    @Test
    void testTemplateChannels() {
        ProcTemplate template = new ProcTemplate("t");
        Var in = template.addChannelArg("in", ChannelType.input(BitsType.BIT));
        new IRBuilder(template.spawns).terminate(ChannelOps.YIELD.insn(in));
        assertThrows(IllegalStateException.class, template::getNextChannels);

        Var nextIn = template.next.addArg("in", ChannelType.input(BitsType.BIT));
        template.next.addArg("st", BitsType.BIT);
        assertEquals(Collections.singletonList(nextIn), template.getNextChannels());

        assertThrows(IllegalArgumentException.class, () -> template.setTop(Collections.<String>emptyList()));
        assertFalse(template.isTop());
        template.setTop(Collections.singletonList("ext"));
        assertTrue(template.isTop());
        assertEquals(Collections.singletonList("ext"), template.getBoundaryChannelNames());
        assertThrows(IllegalStateException.class,
                () -> template.addChannelArg("more", ChannelType.output(BitsType.BIT)));
    }

    @Test
    void testToString() {
        FlatChannel chan = new FlatChannel("c_chan", BitsType.of(32));
        assertEquals("chan @c_chan : bits[32] [send, recv]", chan.toString());
        chan.setSendSupported(false);
        assertEquals("chan @c_chan : bits[32] [recv]", chan.toString());
        assertEquals("schan<bits[1], in>", ChannelType.input(BitsType.BIT).toString());
    }

    @Test
    void testRootParametersMustBeChannels() {
        ProcTemplate template = new ProcTemplate("t");
        template.spawns.addArg("p", BitsType.of(32));
        assertThrows(IllegalArgumentException.class, () -> template.setTop(Collections.singletonList("p")));
        assertFalse(template.isTop());
    }
}
