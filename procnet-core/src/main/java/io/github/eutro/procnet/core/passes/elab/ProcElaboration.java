package io.github.eutro.procnet.core.passes.elab;

import io.github.eutro.procnet.core.ext.CommonExts;
import io.github.eutro.procnet.core.interp.InterpretationException;
import io.github.eutro.procnet.core.passes.InPlaceIRPass;
import io.github.eutro.procnet.core.ssa.FlatChannel;
import io.github.eutro.procnet.core.ssa.Module;
import io.github.eutro.procnet.core.ssa.ProcTemplate;
import io.github.eutro.procnet.core.ssa.Var;
import io.github.eutro.procnet.core.types.ChannelType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Elaborate every root template of a module into a flat network of
 * {@link FlatChannel channels} and {@link io.github.eutro.procnet.core.ssa.ElaboratedProc processes}.
 * <p>
 * Each root is elaborated independently. A root that fails gets an error diagnostic,
 * and elaboration continues with the next. Every template is removed from the module
 * afterwards, whether or not it was instantiated.
 */
public class ProcElaboration implements InPlaceIRPass<Module> {
    private static final Logger LOGGER = LogManager.getLogger();

    /**
     * A singleton instance of this pass, with the {@link ElaborationOptions#DEFAULT default options}.
     */
    public static final ProcElaboration INSTANCE = new ProcElaboration(ElaborationOptions.DEFAULT);

    private final ElaborationOptions options;

    public ProcElaboration(ElaborationOptions options) {
        this.options = options;
    }

    @Override
    public void runInPlace(Module module) {
        List<ProcTemplate> templates = module.getSymbols(ProcTemplate.class);
        Set<ProcTemplate> reached = new HashSet<>();
        try {
            for (ProcTemplate root : templates) {
                if (!root.isTop()) continue;
                reached.add(root);
                elaborateRoot(module, root, reached);
            }
        } finally {
            for (ProcTemplate template : templates) {
                if (!reached.contains(template)) {
                    template.emitWarning("never instantiated by any root");
                }
            }
            int erased = module.eraseAll(ProcTemplate.class);
            LOGGER.debug("erased {} templates", erased);
        }
    }

    private void elaborateRoot(Module module, ProcTemplate root, Set<ProcTemplate> reached) {
        List<FlatChannel> boundaryChannels = createBoundaryChannels(module, root);
        if (boundaryChannels == null) return;

        ElaborationContext ctx = new ElaborationContext(module, root, options);
        try {
            new ElaborationInterpreter().interpretTop(root, boundaryChannels, ctx);
            LOGGER.info("elaborated @{} into {} processes", root.getName(), ctx.getElaboratedProcs().size());
        } catch (InterpretationException e) {
            LOGGER.debug("elaboration of @{} failed", root.getName(), e);
            root.emitError("failed to elaborate: " + e.getMessage());
        } finally {
            reached.addAll(ctx.getInstantiatedTemplates());
        }
    }

    private static List<FlatChannel> createBoundaryChannels(Module module, ProcTemplate root) {
        List<Var> params = root.getChannelArgs();
        List<String> names = root.getBoundaryChannelNames();
        if (names == null) {
            if (!params.isEmpty()) {
                root.emitError(String.format(
                        "failed to elaborate: @%s has %d channel parameters but no boundary channel names",
                        root.getName(), params.size()));
                return null;
            }
            return Collections.emptyList();
        }
        for (Var param : params) {
            if (!(param.getNullable(CommonExts.TYPE) instanceof ChannelType)) {
                root.emitError("failed to elaborate: parameter " + param + " of @" + root.getName()
                        + " is not a channel");
                return null;
            }
        }
        if (names.size() != params.size()) {
            root.emitError(String.format(
                    "failed to elaborate: @%s has %d channel parameters but %d boundary channel names",
                    root.getName(), params.size(), names.size()));
            return null;
        }
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (module.lookup(name) != null || !seen.add(name)) {
                root.emitError("failed to elaborate: boundary channel @" + name + " is already defined");
                return null;
            }
        }
        List<FlatChannel> channels = new ArrayList<>(params.size());
        for (int i = 0; i < params.size(); i++) {
            ChannelType type = (ChannelType) params.get(i).getExtOrThrow(CommonExts.TYPE);
            FlatChannel chan = new FlatChannel(names.get(i), type.elementType);
            if (type.isInput) {
                chan.setSendSupported(false);
            } else {
                chan.setRecvSupported(false);
            }
            channels.add(module.insertBefore(root, chan));
        }
        return channels;
    }
}
