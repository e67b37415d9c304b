package io.github.eutro.procnet.core.ssa;

import io.github.eutro.procnet.core.ext.CommonExts;
import io.github.eutro.procnet.core.ops.ChannelOps;
import io.github.eutro.procnet.core.ops.CommonOps;
import io.github.eutro.procnet.core.types.BitsType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RegionClonerTest {
    @Test
    void testClone() {
        Region from = new Region();
        Var x = from.addArg("x", BitsType.of(8));
        IRBuilder ib = new IRBuilder(from);
        Var k = ib.insert(CommonOps.constant(3), "k", BitsType.of(8));
        Var y = ib.insert(CommonOps.IDENTITY.insn(x, k), "y");
        ib.terminate(ChannelOps.YIELD.insn(y));

        Region into = new Region();
        Var existing = into.addArg("existing", null);
        Map<Var, Var> mapping = new RegionCloner(into).cloneRegion(from);

        assertEquals(Arrays.asList(existing, mapping.get(x)), into.getArgs());
        Var newX = mapping.get(x);
        assertNotSame(x, newX);
        assertEquals("x", newX.name);
        assertEquals(BitsType.of(8), newX.getExtOrThrow(CommonExts.TYPE));

        assertEquals(2, into.getEffects().size());
        Effect constant = into.getEffects().get(0);
        assertSame(from.getEffects().get(0).insn().op, constant.insn().op);
        assertEquals(Collections.singletonList(mapping.get(k)), constant.getAssignsTo());
        assertEquals(BitsType.of(8), mapping.get(k).getExtOrThrow(CommonExts.TYPE));

        Effect identity = into.getEffects().get(1);
        assertEquals(Arrays.asList(newX, mapping.get(k)), identity.insn().args());
        assertEquals(Collections.singletonList(mapping.get(y)), into.getTerminator().args());

        // the source is untouched
        assertEquals(Collections.singletonList(x), from.getArgs());
        assertEquals(Arrays.asList(x, k), from.getEffects().get(1).insn().args());
    }

    @Test
    void testRewriteDoesNotAffectSource() {
        Region from = new Region();
        Var chan = from.addArg("chan", null);
        IRBuilder ib = new IRBuilder(from);
        Var tkn = ib.insert(CommonOps.AFTER_ALL.insn(), "tkn");
        ib.insertMulti(ChannelOps.SRECV.insn(chan, tkn), "tkn", "data");

        Region into = new Region();
        new RegionCloner(into).cloneRegion(from);
        Effect recv = into.getEffects().get(1);
        recv.setInsn(ChannelOps.RECV.create("flat").insn(recv.insn().args().subList(1, 2)));
        into.eraseArgs(0, 1);

        assertTrue(into.getArgs().isEmpty());
        assertSame(ChannelOps.SRECV, from.getEffects().get(1).insn().op);
        assertEquals(Collections.singletonList(chan), from.getArgs());
        assertEquals("recv @flat $tkn", recv.insn().toString());
    }
}
