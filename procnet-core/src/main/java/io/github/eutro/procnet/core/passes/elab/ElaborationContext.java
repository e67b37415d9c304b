package io.github.eutro.procnet.core.passes.elab;

import io.github.eutro.procnet.core.interp.InterpreterContext;
import io.github.eutro.procnet.core.ssa.ElaboratedProc;
import io.github.eutro.procnet.core.ssa.FlatChannel;
import io.github.eutro.procnet.core.ssa.Module;
import io.github.eutro.procnet.core.ssa.ModuleSymbol;
import io.github.eutro.procnet.core.ssa.ProcTemplate;
import io.github.eutro.procnet.core.ssa.RegionCloner;
import io.github.eutro.procnet.core.ssa.Var;
import io.github.eutro.procnet.core.types.Type;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The state of elaborating one root: the values of structured channels, the names
 * allocated so far, and where new symbols go.
 * <p>
 * New symbols are inserted into the module just before the root, in the order they are created.
 */
public class ElaborationContext extends InterpreterContext<FlatChannel> {
    private static final Logger LOGGER = LogManager.getLogger();

    private final Module module;
    private final ModuleSymbol insertionPoint;
    private final ElaborationOptions options;
    private final Set<String> addedSymbols = new HashSet<>();
    private final Set<ProcTemplate> instantiated = new HashSet<>();
    private final List<ElaboratedProc> elaborated = new ArrayList<>();
    private final ProcIdFactory procIds = new ProcIdFactory();
    private ProcId currentProcId = ProcId.EMPTY;

    public ElaborationContext(Module module, ModuleSymbol insertionPoint, ElaborationOptions options) {
        this.module = module;
        this.insertionPoint = insertionPoint;
        this.options = options;
    }

    public Module getModule() {
        return module;
    }

    public ElaborationOptions getOptions() {
        return options;
    }

    public ProcIdFactory getProcIds() {
        return procIds;
    }

    /**
     * Get every template that has been instantiated in this context.
     *
     * @return An unmodifiable view of the templates.
     */
    public Set<ProcTemplate> getInstantiatedTemplates() {
        return Collections.unmodifiableSet(instantiated);
    }

    /**
     * Get every process created in this context, in the order they were created.
     *
     * @return An unmodifiable view of the processes.
     */
    public List<ElaboratedProc> getElaboratedProcs() {
        return Collections.unmodifiableList(elaborated);
    }

    /**
     * Get the identity of the instance whose spawns are being interpreted.
     *
     * @return The identity.
     */
    public ProcId getCurrentProcId() {
        return currentProcId;
    }

    public void setCurrentProcId(ProcId currentProcId) {
        this.currentProcId = currentProcId;
    }

    private boolean existsAlready(String name) {
        return module.lookup(name) != null || addedSymbols.contains(name);
    }

    /**
     * Allocate a name for a new symbol. This is {@code name} itself if it is free, and
     * otherwise {@code name} with the smallest numeric suffix that makes it free.
     *
     * @param name The requested name.
     * @return The allocated name.
     */
    public String makeUniqueSymbol(String name) {
        String unique = name;
        for (int counter = 1; existsAlready(unique); counter++) {
            unique = name + options.getSuffixSeparator() + counter;
        }
        addedSymbols.add(unique);
        return unique;
    }

    /**
     * Declare a new flat channel, named after {@code name}.
     *
     * @param name        The requested name.
     * @param elementType The payload type.
     * @return The channel.
     */
    public FlatChannel createChannel(String name, Type elementType) {
        FlatChannel chan = new FlatChannel(makeUniqueSymbol(name), elementType);
        module.insertBefore(insertionPoint, chan);
        return chan;
    }

    /**
     * Instantiate a template as a concrete process.
     * <p>
     * The next region of the template is cloned as the body of the process, with every
     * structured channel operation on the template's channels rewritten to the flat
     * operation on the corresponding channel, and the channel arguments removed.
     *
     * @param template The template.
     * @param channels The channels the template's next region is bound to, in order.
     * @return The process.
     */
    public ElaboratedProc createElaboratedProc(ProcTemplate template, List<FlatChannel> channels) {
        List<Var> nextChannels;
        try {
            nextChannels = template.getNextChannels();
        } catch (IllegalStateException e) {
            throw new ElaborationException(ElaborationException.Kind.INTERNAL, e.getMessage());
        }
        if (nextChannels.size() != channels.size()) {
            throw new ElaborationException(ElaborationException.Kind.INTERNAL, String.format(
                    "@%s takes %d channels in its next region but %d were yielded",
                    template.getName(), nextChannels.size(), channels.size()));
        }

        ElaboratedProc eproc = new ElaboratedProc(makeUniqueSymbol(template.getName()));
        module.insertBefore(insertionPoint, eproc);
        instantiated.add(template);
        elaborated.add(eproc);

        Map<Var, Var> mapping = new RegionCloner(eproc.body).cloneRegion(template.next);
        Map<Var, FlatChannel> chanMap = new HashMap<>();
        for (int i = 0; i < nextChannels.size(); i++) {
            chanMap.put(mapping.get(nextChannels.get(i)), channels.get(i));
        }
        ChannelLowering.replaceStructuredChannelOps(eproc.body, chanMap);
        eproc.body.eraseArgs(0, nextChannels.size());

        LOGGER.debug("elaborated {} as @{}", currentProcId, eproc.getName());
        return eproc;
    }
}
