package io.github.eutro.procnet.core.ssa;

import io.github.eutro.procnet.core.ext.DelegatingExtHolder;
import io.github.eutro.procnet.core.ext.ExtContainer;
import io.github.eutro.procnet.core.ops.Op;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An instruction: an {@link Op} applied to a list of operands.
 */
public final class Insn extends DelegatingExtHolder {
    public final Op op;
    private final List<Var> args;

    public Insn(Op op, List<Var> args) {
        this.op = op;
        this.args = new ArrayList<>(args);
    }

    public Insn(Op op, Var... args) {
        this(op, Arrays.asList(args));
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    /**
     * Get the operands of this instruction.
     *
     * @return An unmodifiable view of the operands.
     */
    public List<Var> args() {
        return Collections.unmodifiableList(args);
    }

    /**
     * Assign the results of this instruction to some vars.
     *
     * @param vars The vars.
     * @return The effect.
     */
    public Effect assignTo(Var... vars) {
        return new Effect(Arrays.asList(vars), this);
    }

    /**
     * Assign the results of this instruction to some vars.
     *
     * @param vars The vars.
     * @return The effect.
     */
    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }
}
