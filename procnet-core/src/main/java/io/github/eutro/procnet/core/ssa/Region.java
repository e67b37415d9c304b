package io.github.eutro.procnet.core.ssa;

import io.github.eutro.procnet.core.ext.CommonExts;
import io.github.eutro.procnet.core.ext.ExtHolder;
import io.github.eutro.procnet.core.ops.ChannelOps;
import io.github.eutro.procnet.core.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A straight-line list of {@link Effect effects}, with arguments, closed by a terminator.
 * <p>
 * Regions have no control flow; conditional behaviour is expressed with predicates.
 */
public final class Region extends ExtHolder {
    /**
     * Whether vars of the same name should be given distinct indices. This only affects how they display.
     */
    public static final boolean UNIQUE_VAR_NAMES = System.getenv("PROCNET_UNIQUE_VAR_NAMES") != null;

    private final List<Var> args = new ArrayList<>();
    private final List<Effect> effects = new ArrayList<>();
    private Insn terminator = ChannelOps.YIELD.insn();
    private final Map<String, Integer> varNames = UNIQUE_VAR_NAMES ? new HashMap<>() : null;

    /**
     * Create a new var in this region, without assigning it.
     *
     * @param name The name of the var.
     * @return The var.
     */
    public Var newVar(String name) {
        if (varNames == null) {
            return new Var(name, 0);
        }
        int index = varNames.merge(name, 1, Integer::sum) - 1;
        return new Var(name, index);
    }

    /**
     * Create a new var with a type.
     *
     * @param name The name of the var.
     * @param type Its type.
     * @return The var.
     */
    public Var newVar(String name, Type type) {
        Var var = newVar(name);
        var.attachExt(CommonExts.TYPE, type);
        return var;
    }

    /**
     * Append an argument to this region.
     *
     * @param name The name of the argument.
     * @param type Its type, or null if it is untyped.
     * @return The argument.
     */
    public Var addArg(String name, @Nullable Type type) {
        Var arg = type == null ? newVar(name) : newVar(name, type);
        args.add(arg);
        return arg;
    }

    /**
     * Get the arguments of this region.
     *
     * @return An unmodifiable view of the arguments.
     */
    public List<Var> getArgs() {
        return Collections.unmodifiableList(args);
    }

    /**
     * Remove the arguments in {@code [from, to)}. They must no longer be used.
     *
     * @param from The first index to remove.
     * @param to   The index after the last one to remove.
     */
    public void eraseArgs(int from, int to) {
        args.subList(from, to).clear();
    }

    /**
     * Get the effects of this region, which may be modified in place.
     *
     * @return The effects.
     */
    public List<Effect> getEffects() {
        return effects;
    }

    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    public Insn getTerminator() {
        return terminator;
    }

    public void setTerminator(Insn terminator) {
        this.terminator = terminator;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(args.stream()
                .map(arg -> arg + arg.getExt(CommonExts.TYPE).map(ty -> ": " + ty).orElse(""))
                .collect(Collectors.joining(", ", "(", ") {\n")));
        for (Effect effect : effects) {
            sb.append("  ").append(effect).append('\n');
        }
        sb.append("  ").append(terminator).append("\n}");
        return sb.toString();
    }
}
