package io.github.eutro.procnet.core.ssa;

import io.github.eutro.procnet.core.ext.CommonExts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies the contents of one region into another, giving every var a fresh counterpart.
 * <p>
 * Operations are shared between the source and the copy, since they carry no operands.
 */
public class RegionCloner {
    private final Map<Var, Var> varMap = new HashMap<>();
    private final Region into;

    /**
     * Construct a cloner that copies into a region.
     *
     * @param into The region to copy into. Its existing contents are kept, and copied contents are appended.
     */
    public RegionCloner(Region into) {
        this.into = into;
    }

    /**
     * Copy a region. Its arguments are appended to the arguments of the target region,
     * its effects are appended to the target region's effects, and its terminator replaces
     * the target region's terminator.
     *
     * @param from The region to copy.
     * @return The mapping from vars in {@code from} to their copies.
     */
    public Map<Var, Var> cloneRegion(Region from) {
        for (Var arg : from.getArgs()) {
            varMap.put(arg, into.addArg(arg.name, arg.getNullable(CommonExts.TYPE)));
        }
        for (Effect effect : from.getEffects()) {
            Insn insn = effect.insn();
            into.addEffect(insn.op
                    .insn(refreshVars(insn.args()))
                    .assignTo(refreshVars(effect.getAssignsTo())));
        }
        Insn terminator = from.getTerminator();
        into.setTerminator(terminator.op.insn(refreshVars(terminator.args())));
        return Collections.unmodifiableMap(varMap);
    }

    private List<Var> refreshVars(List<Var> vars) {
        List<Var> ret = new ArrayList<>(vars.size());
        for (Var var : vars) {
            ret.add(varMap.computeIfAbsent(var, this::copyVar));
        }
        return ret;
    }

    private Var copyVar(Var old) {
        Var var = into.newVar(old.name);
        old.getExt(CommonExts.TYPE).ifPresent(type -> var.attachExt(CommonExts.TYPE, type));
        return var;
    }
}
