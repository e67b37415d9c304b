package io.github.eutro.procnet.core.ssa;

import io.github.eutro.procnet.core.ext.CommonExts;
import io.github.eutro.procnet.core.types.ChannelType;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A structured process: a reusable template that is parameterised over channels,
 * and may spawn other templates.
 * <p>
 * The {@link #spawns} region runs once per instance. Its arguments are the channel parameters,
 * and it declares local channels and spawns other templates, then yields the channels
 * that the {@link #next} region uses. The {@link #next} region is the per-cycle body. Its
 * leading arguments are the yielded channels, followed by the state of the process.
 * <p>
 * Templates only exist before elaboration, which replaces them with
 * {@link FlatChannel flat channels} and {@link ElaboratedProc elaborated processes}.
 */
public final class ProcTemplate extends ModuleSymbol {
    public final Region spawns = new Region();
    public final Region next = new Region();
    private boolean isTop = false;
    private @Nullable List<String> boundaryChannelNames = null;

    public ProcTemplate(String name) {
        super(name);
    }

    /**
     * Add a channel parameter, as an argument of the spawns region.
     *
     * @param name The name of the parameter.
     * @param type Its type.
     * @return The parameter.
     */
    public Var addChannelArg(String name, ChannelType type) {
        if (boundaryChannelNames != null) {
            throw new IllegalStateException("channel parameters of @" + getName() + " are fixed by its boundary names");
        }
        return spawns.addArg(name, type);
    }

    /**
     * Get the channel parameters of this template.
     *
     * @return The parameters.
     */
    public List<Var> getChannelArgs() {
        return spawns.getArgs();
    }

    /**
     * Get the arguments of the next region which are bound to the channels yielded by the spawns region.
     *
     * @return The channel arguments of the next region.
     */
    public List<Var> getNextChannels() {
        int count = spawns.getTerminator().args().size();
        List<Var> nextArgs = next.getArgs();
        if (count > nextArgs.size()) {
            throw new IllegalStateException(String.format(
                    "@%s yields %d channels but its next region takes %d arguments",
                    getName(), count, nextArgs.size()));
        }
        return nextArgs.subList(0, count);
    }

    public boolean isTop() {
        return isTop;
    }

    /**
     * Mark this template as an elaboration root, without boundary channels.
     */
    public void setTop() {
        isTop = true;
        boundaryChannelNames = null;
    }

    /**
     * Mark this template as an elaboration root, whose channel parameters
     * are exposed as flat channels with the given names.
     *
     * @param names The names, one per channel parameter, in order.
     */
    public void setTop(List<String> names) {
        if (names.size() != getChannelArgs().size()) {
            throw new IllegalArgumentException(String.format(
                    "@%s has %d channel parameters but %d boundary channel names were given",
                    getName(), getChannelArgs().size(), names.size()));
        }
        for (Var param : getChannelArgs()) {
            if (!(param.getNullable(CommonExts.TYPE) instanceof ChannelType)) {
                throw new IllegalArgumentException("parameter " + param + " of @" + getName() + " is not a channel");
            }
        }
        isTop = true;
        boundaryChannelNames = Collections.unmodifiableList(new ArrayList<>(names));
    }

    public @Nullable List<String> getBoundaryChannelNames() {
        return boundaryChannelNames;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("sproc @").append(getName());
        if (isTop) {
            sb.append(" top");
            if (boundaryChannelNames != null) {
                sb.append(' ').append(boundaryChannelNames);
            }
        }
        return sb.append("\n spawns").append(spawns)
                .append("\n next").append(next)
                .toString();
    }
}
