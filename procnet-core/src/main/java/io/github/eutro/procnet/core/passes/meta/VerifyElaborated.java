package io.github.eutro.procnet.core.passes.meta;

import io.github.eutro.procnet.core.ops.ChannelOps;
import io.github.eutro.procnet.core.passes.InPlaceIRPass;
import io.github.eutro.procnet.core.ssa.Effect;
import io.github.eutro.procnet.core.ssa.ElaboratedProc;
import io.github.eutro.procnet.core.ssa.Insn;
import io.github.eutro.procnet.core.ssa.Module;
import io.github.eutro.procnet.core.ssa.ModuleSymbol;
import io.github.eutro.procnet.core.ssa.ProcTemplate;

import java.util.HashSet;
import java.util.Set;

/**
 * Check that a module is fully elaborated: it has no templates left, no two symbols share a name,
 * and every process body only uses flat channel operations, on channels that the module declares.
 */
public class VerifyElaborated implements InPlaceIRPass<Module> {
    public static final VerifyElaborated INSTANCE = new VerifyElaborated();

    @Override
    public void runInPlace(Module module) {
        Set<String> names = new HashSet<>();
        for (ModuleSymbol symbol : module.getSymbols()) {
            if (symbol instanceof ProcTemplate) {
                throw new IllegalStateException("template @" + symbol.getName() + " survived elaboration");
            }
            if (!names.add(symbol.getName())) {
                throw new IllegalStateException("symbol @" + symbol.getName() + " is defined more than once");
            }
        }
        for (ElaboratedProc eproc : module.getSymbols(ElaboratedProc.class)) {
            for (Effect effect : eproc.body.getEffects()) {
                verifyInsn(module, eproc, effect.insn());
            }
            verifyInsn(module, eproc, eproc.body.getTerminator());
        }
    }

    private static void verifyInsn(Module module, ElaboratedProc eproc, Insn insn) {
        if (ChannelOps.isStructured(insn)) {
            throw new IllegalStateException("structured operation " + insn.op + " in @" + eproc.getName());
        }
        String chan = ChannelOps.flatChannelOf(insn);
        if (chan != null && module.lookupChannel(chan) == null) {
            throw new IllegalStateException("@" + eproc.getName() + " uses undeclared channel @" + chan);
        }
    }
}
