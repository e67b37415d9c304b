package io.github.eutro.procnet.core.passes.meta;

import io.github.eutro.procnet.core.ext.CommonExts;
import io.github.eutro.procnet.core.interp.Liveness;
import io.github.eutro.procnet.core.passes.InPlaceIRPass;
import io.github.eutro.procnet.core.ssa.Effect;
import io.github.eutro.procnet.core.ssa.Region;
import io.github.eutro.procnet.core.ssa.Var;

import java.util.List;

/**
 * Compute the {@link CommonExts#LIVENESS liveness} of the vars in a region.
 */
public class ComputeLiveness implements InPlaceIRPass<Region> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeLiveness INSTANCE = new ComputeLiveness();

    @Override
    public void runInPlace(Region region) {
        List<Effect> effects = region.getEffects();
        Liveness liveness = new Liveness(effects.size() + 1);
        for (int i = 0; i < effects.size(); i++) {
            for (Var arg : effects.get(i).insn().args()) {
                liveness.use(arg, i);
            }
        }
        for (Var arg : region.getTerminator().args()) {
            liveness.use(arg, effects.size());
        }
        region.attachExt(CommonExts.LIVENESS, liveness);
    }
}
