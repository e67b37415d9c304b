package io.github.eutro.procnet.core.passes.elab;

import io.github.eutro.procnet.core.interp.Interpreter;
import io.github.eutro.procnet.core.interp.InterpreterContext;
import io.github.eutro.procnet.core.ops.ChannelOps;
import io.github.eutro.procnet.core.ssa.Effect;
import io.github.eutro.procnet.core.ssa.FlatChannel;
import io.github.eutro.procnet.core.ssa.ProcTemplate;
import io.github.eutro.procnet.core.ssa.Var;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Interprets the spawns regions of templates, instantiating each spawned template
 * as an {@link io.github.eutro.procnet.core.ssa.ElaboratedProc elaborated process}.
 * <p>
 * Instances are created bottom-up: the spawns of a template are interpreted,
 * creating its children, before the template itself is instantiated.
 */
public class ElaborationInterpreter extends Interpreter<ElaborationContext, FlatChannel> {
    private static final Logger LOGGER = LogManager.getLogger();

    public ElaborationInterpreter() {
        addRule(ChannelOps.SCHAN, this::interpretSchan);
        addRule(ChannelOps.SPAWN, this::interpretSpawn);
        addRule(ChannelOps.YIELD.key, (effect, ctx) -> {
        });
    }

    /**
     * Elaborate a root template.
     *
     * @param root              The root.
     * @param boundaryChannels  The channels its parameters are bound to.
     * @param ctx               A fresh context for this root.
     * @throws ElaborationException If the root cannot be elaborated.
     */
    public void interpretTop(ProcTemplate root, List<FlatChannel> boundaryChannels, ElaborationContext ctx) {
        ctx.setCurrentProcId(ctx.getProcIds().createProcId(ProcId.EMPTY, root, true));
        try (InterpreterContext.Scope ignored = ctx.pushLiveness(getOrCreateLiveness(root.spawns))) {
            interpretTemplate(root, boundaryChannels, ctx);
        }
    }

    private void interpretTemplate(ProcTemplate template, List<FlatChannel> channels, ElaborationContext ctx) {
        List<FlatChannel> results = interpret(template.spawns, channels, ctx);
        ctx.createElaboratedProc(template, results);
    }

    private void interpretSchan(Effect effect, ElaborationContext ctx) {
        ChannelOps.LocalDecl decl = ChannelOps.SCHAN.cast(effect.insn().op).arg;
        List<Var> ends = effect.getAssignsTo();
        if (ends.size() != 2) {
            throw new ElaborationException(ElaborationException.Kind.INTERNAL,
                    "schan must have 2 results but has " + ends.size());
        }
        FlatChannel chan = ctx.createChannel(decl.name, decl.elementType);
        ctx.set(ends.get(0), chan);
        ctx.set(ends.get(1), chan);
    }

    private void interpretSpawn(Effect effect, ElaborationContext ctx) {
        String calleeName = ChannelOps.SPAWN.cast(effect.insn().op).arg;
        ProcTemplate callee = ctx.getModule().lookupTemplate(calleeName);
        if (callee == null) {
            throw new ElaborationException(ElaborationException.Kind.INVALID_REFERENCE,
                    "failed to resolve callee @" + calleeName);
        }

        List<FlatChannel> arguments = ctx.get(effect.insn().args());
        ProcId parent = ctx.getCurrentProcId();
        try (InterpreterContext.Scope ignored = ctx.pushLiveness(getOrCreateLiveness(callee.spawns))) {
            if (arguments.size() != callee.getChannelArgs().size()) {
                throw new ElaborationException(ElaborationException.Kind.INTERNAL, String.format(
                        "Call to %s requires %d arguments but got %d",
                        calleeName, callee.getChannelArgs().size(), arguments.size()));
            }
            ElaborationOptions options = ctx.getOptions();
            if (options.isDetectRecursion() && parent.contains(callee)) {
                throw new ElaborationException(ElaborationException.Kind.RECURSIVE_INSTANTIATION, String.format(
                        "@%s is instantiated recursively, via %s", calleeName, parent));
            }
            ProcId id = ctx.getProcIds().createProcId(parent, callee, true);
            if (id.depth() > options.getMaxSpawnDepth()) {
                throw new ElaborationException(ElaborationException.Kind.DEPTH_EXCEEDED, String.format(
                        "spawns nest deeper than %d, at %s", options.getMaxSpawnDepth(), parent));
            }
            LOGGER.debug("spawning {}", id);
            ctx.setCurrentProcId(id);
            interpretTemplate(callee, arguments, ctx);
        } finally {
            ctx.setCurrentProcId(parent);
        }
    }
}
