package io.github.eutro.procnet.core.test;

import io.github.eutro.procnet.core.ops.ChannelOps;
import io.github.eutro.procnet.core.ops.CommonOps;
import io.github.eutro.procnet.core.ssa.IRBuilder;
import io.github.eutro.procnet.core.ssa.Module;
import io.github.eutro.procnet.core.ssa.ProcTemplate;
import io.github.eutro.procnet.core.ssa.Var;
import io.github.eutro.procnet.core.types.BitsType;
import io.github.eutro.procnet.core.types.ChannelType;
import io.github.eutro.procnet.core.types.TokenType;

import java.util.Arrays;
import java.util.List;

public class Fixtures {
    public static final BitsType I32 = BitsType.of(32);

    /**
     * A template with an input and an output channel, which forwards one value per cycle,
     * and carries a 32-bit state.
     */
    public static ProcTemplate forwarder(String name) {
        ProcTemplate template = new ProcTemplate(name);
        Var in = template.addChannelArg("in", ChannelType.input(I32));
        Var out = template.addChannelArg("out", ChannelType.output(I32));
        new IRBuilder(template.spawns).terminate(ChannelOps.YIELD.insn(in, out));

        Var nextIn = template.next.addArg("in", ChannelType.input(I32));
        Var nextOut = template.next.addArg("out", ChannelType.output(I32));
        Var state = template.next.addArg("st", I32);
        IRBuilder ib = new IRBuilder(template.next);
        Var tkn = ib.insert(CommonOps.AFTER_ALL.insn(), "tkn", TokenType.INSTANCE);
        List<Var> recv = ib.insertMulti(ChannelOps.SRECV.insn(nextIn, tkn), "tkn", "data");
        ib.insert(ChannelOps.SSEND.insn(nextOut, recv.get(0), recv.get(1)), "tkn");
        ib.terminate(ChannelOps.YIELD.insn(state));
        return template;
    }

    public static List<Var> localChannel(IRBuilder ib, String name) {
        return ib.insertMulti(ChannelOps.SCHAN.create(new ChannelOps.LocalDecl(name, I32)).insn(),
                name + "_send", name + "_recv");
    }

    public static void spawn(IRBuilder ib, String callee, Var... args) {
        ib.insert(ChannelOps.SPAWN.create(callee).insn(args));
    }

    /**
     * A root {@code Top} with boundary channels {@code in} and {@code out}, which spawns
     * {@code C} twice, each time with one local channel and one boundary channel.
     */
    public static ProcTemplate twoForwarders(String callee) {
        ProcTemplate top = new ProcTemplate("Top");
        Var in = top.addChannelArg("in", ChannelType.input(I32));
        Var out = top.addChannelArg("out", ChannelType.output(I32));
        IRBuilder ib = new IRBuilder(top.spawns);
        List<Var> first = localChannel(ib, "c_chan");
        spawn(ib, callee, in, first.get(0));
        List<Var> second = localChannel(ib, "c_chan");
        spawn(ib, callee, second.get(1), out);
        top.setTop(Arrays.asList("in", "out"));
        return top;
    }

    public static Module twoForwardersModule() {
        Module module = new Module();
        module.add(forwarder("C"));
        module.add(twoForwarders("C"));
        return module;
    }
}
