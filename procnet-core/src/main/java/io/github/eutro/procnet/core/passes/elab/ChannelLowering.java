package io.github.eutro.procnet.core.passes.elab;

import io.github.eutro.procnet.core.ops.ChannelOps;
import io.github.eutro.procnet.core.ops.OpKey;
import io.github.eutro.procnet.core.ops.UnaryOpKey;
import io.github.eutro.procnet.core.ssa.Effect;
import io.github.eutro.procnet.core.ssa.FlatChannel;
import io.github.eutro.procnet.core.ssa.Insn;
import io.github.eutro.procnet.core.ssa.Region;
import io.github.eutro.procnet.core.ssa.Var;

import java.util.List;
import java.util.Map;

/**
 * Rewrites structured channel operations into flat ones.
 */
final class ChannelLowering {
    private ChannelLowering() {
    }

    /**
     * Replace every {@code ssend}, {@code srecv} and {@code srecv_nb} in a region with a
     * {@code send}, {@code recv} or {@code recv_nb} on the flat channel its channel operand
     * is mapped to.
     * <p>
     * The token, data and predicate operands, and the results, are kept as they are.
     *
     * @param region  The region.
     * @param chanMap The flat channel of each structured channel var.
     */
    static void replaceStructuredChannelOps(Region region, Map<Var, FlatChannel> chanMap) {
        for (Effect effect : region.getEffects()) {
            OpKey key = effect.insn().op.key;
            UnaryOpKey<String> flatKey;
            if (key == ChannelOps.SSEND.key) {
                flatKey = ChannelOps.SEND;
            } else if (key == ChannelOps.SRECV.key) {
                flatKey = ChannelOps.RECV;
            } else if (key == ChannelOps.SRECV_NB.key) {
                flatKey = ChannelOps.RECV_NB;
            } else {
                continue;
            }
            List<Var> args = effect.insn().args();
            FlatChannel chan = args.isEmpty() ? null : chanMap.get(args.get(0));
            if (chan == null) {
                throw new ElaborationException(ElaborationException.Kind.INTERNAL,
                        effect.insn() + " does not operate on a channel of the process");
            }
            effect.setInsn(new Insn(flatKey.create(chan.getName()), args.subList(1, args.size())));
        }
    }
}
