package io.github.eutro.procnet.core.ops;

import io.github.eutro.procnet.core.ext.DelegatingExtHolder;
import io.github.eutro.procnet.core.ext.ExtContainer;
import io.github.eutro.procnet.core.ssa.Insn;
import io.github.eutro.procnet.core.ssa.Var;

import java.util.List;

/**
 * An operation: an {@link OpKey} together with its immediates, if it has any.
 * <p>
 * Operations hold no operands, so one operation may be shared by many instructions.
 */
public /* virtual */ class Op extends DelegatingExtHolder {
    /**
     * The key of the operation.
     */
    public final OpKey key;

    protected Op(OpKey key) {
        this.key = key;
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    /**
     * Apply this operation to some operands.
     *
     * @param vars The operands.
     * @return The instruction.
     */
    public Insn insn(Var... vars) {
        return new Insn(this, vars);
    }

    /**
     * Apply this operation to some operands.
     *
     * @param vars The operands.
     * @return The instruction.
     */
    public Insn insn(List<Var> vars) {
        return new Insn(this, vars);
    }
}
